package io.runconfig.search.space;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered grouping of dimensions, scoped per search entity.
 *
 * <p>Insertion order defines the coordinate slot order: the dimensions of entity 0
 * come first, then those of entity 1, and so on. Entity indices must be added
 * contiguously starting at 0.</p>
 */
public class DimensionSet {

    private static final Logger log = LoggerFactory.getLogger(DimensionSet.class);

    private final List<Slot> slots = new ArrayList<>();
    private int entityCount;

    /**
     * A single coordinate slot: the entity it belongs to and the axis it drives.
     */
    public record Slot(int entityIndex, Dimension dimension) {}

    /**
     * Appends the dimensions of one entity, extending the global slot order.
     *
     * @param entityIndex Either the index of the last added entity or the next one
     * @param dimensions Dimensions in evaluation order
     * @return this set, for chaining
     * @throws DimensionException if the entity index would leave a gap
     */
    public DimensionSet addDimensions(int entityIndex, List<Dimension> dimensions) {
        if (entityIndex < 0 || entityIndex > entityCount || (entityIndex < entityCount - 1)) {
            throw new DimensionException(String.format(
                "Entity indices must be contiguous: cannot add entity %d after %d entities",
                entityIndex, entityCount));
        }
        for (Dimension dimension : dimensions) {
            for (Slot existing : slots) {
                if (existing.entityIndex() == entityIndex && existing.dimension().name().equals(dimension.name())) {
                    throw new DimensionException(String.format(
                        "Dimension '%s' already defined for entity %d", dimension.name(), entityIndex));
                }
            }
            slots.add(new Slot(entityIndex, dimension));
        }
        entityCount = Math.max(entityCount, entityIndex + 1);
        log.debug("Added {} dimension(s) for entity {} ({} slots total)", dimensions.size(), entityIndex, slots.size());
        return this;
    }

    /**
     * Translates a coordinate into per-entity, per-dimension values.
     *
     * @throws DimensionException if the coordinate length differs from the slot count
     */
    public Map<Integer, Map<String, Integer>> valuesFor(Coordinate coordinate) {
        checkArity(coordinate);

        Map<Integer, Map<String, Integer>> values = new LinkedHashMap<>();
        for (int i = 0; i < slots.size(); i++) {
            Slot slot = slots.get(i);
            values.computeIfAbsent(slot.entityIndex(), k -> new LinkedHashMap<>())
                .put(slot.dimension().name(), slot.dimension().valueAt(coordinate.get(i)));
        }
        return values;
    }

    /**
     * Returns the coordinate with every slot at its dimension's minimum bound.
     */
    public Coordinate startingCoordinate() {
        int[] start = new int[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            start[i] = slots.get(i).dimension().minBound();
        }
        return new Coordinate(start);
    }

    /**
     * Raises every slot of the coordinate to its dimension's minimum bound.
     */
    public Coordinate clampToMinimums(Coordinate coordinate) {
        checkArity(coordinate);
        Coordinate clamped = coordinate;
        for (int i = 0; i < slots.size(); i++) {
            clamped = clamped.clampToBound(i, slots.get(i).dimension().minBound());
        }
        return clamped;
    }

    /**
     * Returns true if no slot is below its dimension's minimum bound.
     */
    public boolean isWithinBounds(Coordinate coordinate) {
        return clampToMinimums(coordinate).equals(coordinate);
    }

    public List<Slot> getSlots() {
        return Collections.unmodifiableList(slots);
    }

    public int slotCount() {
        return slots.size();
    }

    public int entityCount() {
        return entityCount;
    }

    private void checkArity(Coordinate coordinate) {
        if (coordinate.size() != slots.size()) {
            throw new DimensionException(slots.size(), coordinate.size());
        }
    }
}
