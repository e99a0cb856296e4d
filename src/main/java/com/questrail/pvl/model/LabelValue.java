package com.questrail.pvl.model;

/**
 * Canonical in-memory representation of a single PVL label value.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code LabelValue} is the closed set of value shapes a label tree may hold.
 * The variant of every value is decided once, when the tree is built, so that
 * encoders dispatch on a known tag rather than inspecting arbitrary objects.
 * </p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link NullValue}: the PVL {@code NULL} literal</li>
 *   <li>{@link BooleanValue}: {@code TRUE} / {@code FALSE}</li>
 *   <li>{@link IntegerValue}, {@link RealValue}: numeric scalars</li>
 *   <li>{@link TextValue}: symbols and strings</li>
 *   <li>{@link UnitsValue}: a scalar annotated with a unit label</li>
 *   <li>{@link SequenceValue}: ordered {@code ( ... )} collections</li>
 *   <li>{@link SetValue}: unordered {@code { ... }} collections</li>
 *   <li>{@link LabelMapping}: nested OBJECT / GROUP blocks</li>
 *   <li>{@link OpaqueValue}: a decoded value with no textual mapping</li>
 * </ul>
 *
 * <p>
 * All variants are immutable. A tree of {@code LabelValue}s is a pure tree:
 * it can not contain cycles because every container copies its children at
 * construction time.
 * </p>
 */
public sealed interface LabelValue
        permits NullValue, BooleanValue, IntegerValue, RealValue, TextValue,
                UnitsValue, SequenceValue, SetValue, LabelMapping, OpaqueValue
{
}
