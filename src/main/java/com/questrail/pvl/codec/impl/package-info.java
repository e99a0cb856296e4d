/**
 * Label Codec — Encoder Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete encoder that walks a label tree and
 * emits dialect-correct text.</p>
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   LabelMapping
 *        → AssignmentColumn.detect   (PDS3 only, once per call)
 *        → BlockEncoder.encodeBlock  (recursive, owns indentation)
 *            → LabelValueCodec       (scalars, units, sequences, sets)
 *                → TextQuoter        (dialect quoting collaborator)
 *        → terminal token
 * </pre>
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>single pass and synchronous</li>
 *   <li>sink-agnostic</li>
 *   <li>stateless between calls</li>
 * </ul>
 *
 * <p>Per-call values (the sink and the PDS3 assignment column) travel in a
 * {@link com.questrail.pvl.codec.impl.BlockContext}; nothing computed during a
 * call is stored on the encoder.</p>
 */
package com.questrail.pvl.codec.impl;
