package org.cataphract.runtime.model;

/**
 * A side in the campaign.
 *
 * @param id   Faction id.
 * @param name Display name.
 */
public record Faction(long id, String name) {
}
