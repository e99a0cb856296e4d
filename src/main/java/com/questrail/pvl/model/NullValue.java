package com.questrail.pvl.model;

/**
 * The PVL {@code NULL} value.
 */
public enum NullValue implements LabelValue
{
    INSTANCE
}
