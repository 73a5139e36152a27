package fmap.domain.feed;

import fmap.common.EHtSlotIdConvention;
import fmap.common.MappingConstants;

/**
 * Global slot id and label rules shared by the normalizer and the review layer
 * @since 14/10/2026
 */
public final class SlotIdentifiers {
    private SlotIdentifiers() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    /**
     * Global id of a slot inside a feed unit.
     * Regular units: {@code unitId * 4 + slotIndex}. High-throughput units follow {@code convention};
     * a single-slot unit numbered below {@value MappingConstants#HT_UNIT_ID_BASE} always uses the formula,
     * its unit id would collide with the slots of unit 0.
     */
    public static int unitSlotId(int unitId, int slotIndex, boolean highThroughput, EHtSlotIdConvention convention) {
        if (highThroughput && convention == EHtSlotIdConvention.UNIT_ID && unitId >= MappingConstants.HT_UNIT_ID_BASE) {
            return unitId;
        }
        return unitId * MappingConstants.SLOTS_PER_UNIT + slotIndex;
    }

    /**
     * "AMS-A Slot 1" for regular units, "HT-A" for high-throughput units
     */
    public static String unitSlotLabel(int unitId, int slotIndex, boolean highThroughput) {
        String unit = unitLetter(unitId);
        if (highThroughput) {
            return "HT-" + unit;
        }
        return "AMS-" + unit + " Slot " + (slotIndex + 1);
    }

    /**
     * "External" on single-holder printers, "Ext-L"/"Ext-R" when both holders are present
     */
    public static String externalLabel(int positionId, boolean dualExternal) {
        if (!dualExternal) {
            return "External";
        }
        return positionId == MappingConstants.EXTERNAL_PRIMARY_ID ? "Ext-L" : "Ext-R";
    }

    private static String unitLetter(int unitId) {
        int ordinal = unitId >= MappingConstants.HT_UNIT_ID_BASE ? unitId - MappingConstants.HT_UNIT_ID_BASE : unitId;
        if (ordinal < 0 || ordinal >= 26) {
            return String.valueOf(unitId);
        }
        return String.valueOf((char) ('A' + ordinal));
    }
}
