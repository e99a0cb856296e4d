package com.questrail.pvl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LabelMapping
 * -----------------------------------------------------------------------------
 * An ordered sequence of {@code key = value} statements.
 *
 * <h2>Core Semantics</h2>
 * <ul>
 *   <li>Insertion order is significant and is the output order</li>
 *   <li>Keys need not be unique; every occurrence is kept</li>
 *   <li>The {@link MappingKind} tag, not the contents, decides whether a
 *       nested mapping is written as an OBJECT or a GROUP block</li>
 * </ul>
 *
 * <p>The top level of a label is a {@code LabelMapping} as well; its kind is
 * ignored because the top level has no begin/end lines.</p>
 *
 * <h2>Immutability</h2>
 * Instances are immutable once built. Nested values are captured by reference,
 * and every {@link LabelValue} is itself immutable, so a finished tree can be
 * shared freely between threads.
 */
public final class LabelMapping implements LabelValue
{
    private final MappingKind kind;
    private final List<LabelEntry> entries;

    private LabelMapping(MappingKind kind, List<LabelEntry> entries)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.entries = List.copyOf(entries);
    }

    public MappingKind kind()
    {
        return kind;
    }

    public boolean isGroup()
    {
        return kind == MappingKind.GROUP;
    }

    /**
     * Returns the statements of this mapping, in insertion order.
     */
    public List<LabelEntry> entries()
    {
        return entries;
    }

    public int size()
    {
        return entries.size();
    }

    public boolean isEmpty()
    {
        return entries.isEmpty();
    }

    /**
     * Returns the value of the first statement with the given key.
     */
    public Optional<LabelValue> get(String key)
    {
        Objects.requireNonNull(key, "key");
        for (LabelEntry e : entries) {
            if (e.key().equals(key)) {
                return Optional.of(e.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the values of every statement with the given key, in order.
     */
    public List<LabelValue> getAll(String key)
    {
        Objects.requireNonNull(key, "key");
        List<LabelValue> values = new ArrayList<>();
        for (LabelEntry e : entries) {
            if (e.key().equals(key)) {
                values.add(e.value());
            }
        }
        return values;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LabelMapping other)) {
            return false;
        }
        return kind == other.kind && entries.equals(other.entries);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, entries);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(kind == MappingKind.GROUP ? "Group{" : "Object{");
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            LabelEntry e = entries.get(i);
            sb.append(e.key()).append('=').append(e.value());
        }
        return sb.append('}').toString();
    }

    public static Builder builder()
    {
        return new Builder(MappingKind.OBJECT);
    }

    public static Builder groupBuilder()
    {
        return new Builder(MappingKind.GROUP);
    }

    public static LabelMapping empty()
    {
        return builder().build();
    }

    public static final class Builder
    {
        private final MappingKind kind;
        private final List<LabelEntry> entries = new ArrayList<>();

        private Builder(MappingKind kind)
        {
            this.kind = kind;
        }

        public Builder put(String key, LabelValue value)
        {
            entries.add(new LabelEntry(key, value));
            return this;
        }

        public Builder put(String key, long value)
        {
            return put(key, IntegerValue.of(value));
        }

        public Builder put(String key, double value)
        {
            return put(key, RealValue.of(value));
        }

        public Builder put(String key, boolean value)
        {
            return put(key, BooleanValue.of(value));
        }

        public Builder put(String key, String value)
        {
            return put(key, TextValue.of(value));
        }

        public Builder putNull(String key)
        {
            return put(key, NullValue.INSTANCE);
        }

        public LabelMapping build()
        {
            return new LabelMapping(kind, entries);
        }
    }
}
