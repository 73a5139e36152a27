package fmap.domain.feed;

import java.util.OptionalInt;

/**
 * A non-empty slot flattened out of a {@link FeedSnapshot}
 *
 * @param materialType material label as reported by the printer
 * @param color normalized comparison color (6 lowercase hex digits, empty when unknown)
 * @param displayColor color for display, "#RRGGBB" with any alpha channel dropped
 * @param unitId owning unit, -1 for external feeds
 * @param slotIndex index within the unit, position offset (0/1) for external feeds
 * @param globalSlotId flat identifier sent to the printer, unique within one inventory
 * @param fingerprint spool fingerprint, empty string when the spool carries none
 * @param extruderId extruder this slot can feed, absent on single-extruder machines
 * @since 14/10/2026
 */
public record LoadedFeedEntry(String materialType,
                              String color,
                              String displayColor,
                              int unitId,
                              int slotIndex,
                              int globalSlotId,
                              String fingerprint,
                              boolean external,
                              boolean highThroughput,
                              OptionalInt extruderId,
                              String subBrand,
                              String label) {

    public boolean hasMaterialType(String requiredType) {
        return FeedColors.sameMaterial(materialType, requiredType);
    }

    public boolean hasColor(String normalizedColor) {
        return !color.isEmpty() && color.equals(normalizedColor);
    }

    public boolean hasFingerprint(String requiredFingerprint) {
        return !fingerprint.isEmpty() && fingerprint.equals(requiredFingerprint);
    }

    public boolean isOnExtruder(int extruder) {
        return extruderId.isPresent() && extruderId.getAsInt() == extruder;
    }
}
