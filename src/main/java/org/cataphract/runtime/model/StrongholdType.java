package org.cataphract.runtime.model;

public enum StrongholdType {
    TOWN,
    CITY,
    FORTRESS
}
