package org.cataphract.runtime.model;

public enum UnitCategory {
    INFANTRY,
    CAVALRY
}
