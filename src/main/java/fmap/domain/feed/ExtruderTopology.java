package fmap.domain.feed;

import fmap.common.MappingConstants;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Wiring of feed units to extruders on dual-extruder printers
 * @since 14/10/2026
 */
public record ExtruderTopology(Map<Integer, Integer> unitToExtruder) {

    public ExtruderTopology {
        unitToExtruder = unitToExtruder == null ? Map.of() : Map.copyOf(unitToExtruder);
    }

    public OptionalInt extruderForUnit(int unitId) {
        Integer extruder = unitToExtruder.get(unitId);
        return extruder == null ? OptionalInt.empty() : OptionalInt.of(extruder);
    }

    /**
     * External holders are wired by position: 254 feeds extruder 0, 255 feeds extruder 1
     */
    public OptionalInt extruderForExternal(int positionId) {
        if (positionId != MappingConstants.EXTERNAL_PRIMARY_ID && positionId != MappingConstants.EXTERNAL_SECONDARY_ID) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(positionId - MappingConstants.EXTERNAL_PRIMARY_ID);
    }

    public boolean isEmpty() {
        return unitToExtruder.isEmpty();
    }
}
