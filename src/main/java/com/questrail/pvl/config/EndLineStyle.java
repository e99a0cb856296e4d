package com.questrail.pvl.config;

/**
 * How the line closing an OBJECT or GROUP block is written.
 */
public enum EndLineStyle
{
    /** {@code END_GROUP = NAME}: the close token is an assignment repeating the block name. */
    REPEAT_NAME,

    /** {@code End_Group}: the close token stands alone. */
    BARE
}
