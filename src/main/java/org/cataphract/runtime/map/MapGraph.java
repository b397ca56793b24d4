package org.cataphract.runtime.map;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Hex, road and river topology of one campaign. Topology never changes during a
 * tick; only the per-hex foraging state does.
 * <p>
 * Hexes are adjacent when their axial coordinates are neighbors. Roads add
 * edges between the hexes they connect, so two road-linked hexes count as
 * neighbors even on a coarse map.
 */
public class MapGraph {

    private final Map<Long, Hex> hexes = new TreeMap<>();
    private final List<Road> roads;
    private final List<RiverCrossing> crossings;

    @JsonIgnore
    private final Map<HexCoord, Long> coordIndex = new HashMap<>();

    public MapGraph(Collection<Hex> hexes, Collection<Road> roads, Collection<RiverCrossing> crossings) {
        for (Hex hex : hexes) {
            if (this.hexes.put(hex.getId(), hex) != null) {
                throw new IllegalArgumentException("Duplicate hex id " + hex.getId());
            }
            coordIndex.put(hex.getCoord(), hex.getId());
        }
        this.roads = List.copyOf(roads);
        this.crossings = List.copyOf(crossings);
    }

    /**
     * @return a copy with independent foraging state and shared topology.
     */
    public MapGraph copy() {
        List<Hex> copies = new ArrayList<>(hexes.size());
        for (Hex hex : hexes.values()) {
            copies.add(hex.copy());
        }
        return new MapGraph(copies, roads, crossings);
    }

    public boolean hasHex(long hexId) {
        return hexes.containsKey(hexId);
    }

    public Optional<Hex> findHex(long hexId) {
        return Optional.ofNullable(hexes.get(hexId));
    }

    /**
     * @param hexId Id of a hex known to exist.
     * @return the hex.
     * @throws IllegalArgumentException if the hex does not exist.
     */
    public Hex getHex(long hexId) {
        Hex hex = hexes.get(hexId);
        if (hex == null) {
            throw new IllegalArgumentException("Unknown hex " + hexId);
        }
        return hex;
    }

    public Collection<Hex> getHexes() {
        return Collections.unmodifiableCollection(hexes.values());
    }

    public List<Road> getRoads() {
        return roads;
    }

    public List<RiverCrossing> getCrossings() {
        return crossings;
    }

    public Optional<Road> findRoad(long a, long b) {
        return roads.stream().filter(road -> road.connects(a, b)).findFirst();
    }

    public Optional<RiverCrossing> findCrossing(long a, long b, RiverCrossing.Kind kind) {
        return crossings.stream().filter(c -> c.kind() == kind && c.connects(a, b)).findFirst();
    }

    public boolean isNavigable(long hexId) {
        Hex hex = hexes.get(hexId);
        return hex != null && hex.getTerrain().isNavigable();
    }

    /**
     * @return the hex-step distance between two existing hexes.
     */
    public int distance(long a, long b) {
        return getHex(a).getCoord().distanceTo(getHex(b).getCoord());
    }

    public boolean areAdjacent(long a, long b) {
        return a != b && (distance(a, b) == 1 || findRoad(a, b).isPresent());
    }

    /**
     * Lists the existing neighbors of a hex in ascending id order.
     */
    public List<Long> neighbors(long hexId) {
        TreeSet<Long> result = new TreeSet<>();
        for (HexCoord coord : getHex(hexId).getCoord().neighbors()) {
            Long id = coordIndex.get(coord);
            if (id != null) {
                result.add(id);
            }
        }
        for (Road road : roads) {
            if (road.fromHexId() == hexId) {
                result.add(road.toHexId());
            } else if (road.toHexId() == hexId) {
                result.add(road.fromHexId());
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * @param centerHexId Center of the area.
     * @param radius      Maximum hex-step distance.
     * @return ids of existing hexes within the radius, center included.
     */
    public List<Long> hexesWithin(long centerHexId, int radius) {
        HexCoord center = getHex(centerHexId).getCoord();
        List<Long> result = new ArrayList<>();
        for (Hex hex : hexes.values()) {
            if (hex.getCoord().distanceTo(center) <= radius) {
                result.add(hex.getId());
            }
        }
        return result;
    }

    /**
     * Breadth-first search over land hexes.
     *
     * @param from Start hex.
     * @param to   Destination hex.
     * @return the number of hops on the shortest land path, or empty if none exists.
     */
    public OptionalInt shortestLandPath(long from, long to) {
        if (!hasHex(from) || !hasHex(to)) {
            return OptionalInt.empty();
        }
        if (from == to) {
            return OptionalInt.of(0);
        }
        Map<Long, Integer> hops = new HashMap<>();
        Deque<Long> queue = new ArrayDeque<>();
        hops.put(from, 0);
        queue.add(from);
        while (!queue.isEmpty()) {
            long current = queue.poll();
            int next = hops.get(current) + 1;
            for (long neighbor : neighbors(current)) {
                if (hops.containsKey(neighbor) || !getHex(neighbor).getTerrain().isLand()) {
                    continue;
                }
                if (neighbor == to) {
                    return OptionalInt.of(next);
                }
                hops.put(neighbor, next);
                queue.add(neighbor);
            }
        }
        return OptionalInt.empty();
    }
}
