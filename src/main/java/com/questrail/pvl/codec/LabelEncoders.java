package com.questrail.pvl.codec;

import com.questrail.pvl.codec.impl.DefaultLabelEncoder;
import com.questrail.pvl.config.LabelDialect;

/**
 * Factory for {@link LabelEncoder}s bound to a dialect.
 */
public final class LabelEncoders
{
    private static final LabelEncoder PVL = new DefaultLabelEncoder(LabelDialect.DEFAULT);
    private static final LabelEncoder CUBE = new DefaultLabelEncoder(LabelDialect.CUBE);
    private static final LabelEncoder PDS3 = new DefaultLabelEncoder(LabelDialect.PDS3);

    private LabelEncoders() {}

    public static LabelEncoder forDialect(LabelDialect dialect)
    {
        return new DefaultLabelEncoder(dialect);
    }

    /** Encoder for the default PVL dialect. */
    public static LabelEncoder pvl()
    {
        return PVL;
    }

    /** Encoder for ISIS cube labels. */
    public static LabelEncoder cube()
    {
        return CUBE;
    }

    /** Encoder for column-aligned PDS3 labels. */
    public static LabelEncoder pds3()
    {
        return PDS3;
    }
}
