package com.questrail.pvl.model;

/**
 * Selects the structural token family a nested {@link LabelMapping} is
 * written with.
 */
public enum MappingKind
{
    /** Written with the dialect's object tokens. */
    OBJECT,

    /** Written with the dialect's group tokens. */
    GROUP
}
