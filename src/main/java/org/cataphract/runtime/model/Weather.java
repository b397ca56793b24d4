package org.cataphract.runtime.model;

/**
 * Campaign-wide weather. Governs the weather factor of marches.
 */
public enum Weather {
    CLEAR,
    BAD,
    VERY_BAD
}
