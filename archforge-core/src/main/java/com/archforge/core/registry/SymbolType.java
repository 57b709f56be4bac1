package com.archforge.core.registry;

/**
 * What a registered symbol denotes.
 */
public enum SymbolType {
    /** A class-like unit from the model. */
    CLASS,
    /** A unit property. */
    PROPERTY,
    /** A unit method. */
    METHOD,
    /** A name exported by a generated artifact that has no unit in the model. */
    EXPORT
}
