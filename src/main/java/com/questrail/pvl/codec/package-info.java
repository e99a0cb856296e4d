/**
 * Label Codec — Encoder Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for PVL-family
 * labels. The codec layer turns an in-memory label tree into dialect-correct
 * text:</p>
 *
 * <ul>
 *   <li>OBJECT / GROUP block structure and indentation</li>
 *   <li>Scalar and collection textualization</li>
 *   <li>Per-dialect structural tokens and end-line style</li>
 *   <li>PDS3 global assignment-column alignment</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   LabelMapping (model)
 *        → LabelEncoder         (this package, dialect chosen at construction)
 *            → LabelSink        (append-only bytes)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Decoding labels back into trees is <strong>not</strong> part of this
 *       layer.</li>
 *   <li>Whether text needs quoting is delegated to the dialect's
 *       {@link com.questrail.pvl.codec.quote.TextQuoter}.</li>
 *   <li>All failures are {@link com.questrail.pvl.codec.LabelEncodeException}s
 *       and abort the call.</li>
 * </ul>
 */
package com.questrail.pvl.codec;
