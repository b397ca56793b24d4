package org.cataphract.runtime.model;

/**
 * A kind of troops a detachment is made of.
 *
 * @param id         Unit type id.
 * @param name       Display name.
 * @param category   Infantry or cavalry; drives supply, column length and upkeep.
 * @param skirmisher Whether the unit is trained for harrying.
 */
public record UnitType(long id, String name, UnitCategory category, boolean skirmisher) {

    public boolean isCavalry() {
        return category == UnitCategory.CAVALRY;
    }
}
