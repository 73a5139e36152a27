package fmap.domain.mapping;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * One filament line item of a sliced print job
 *
 * @param slotId 1-based filament slot in the job file, only used to position the print command mapping
 * @param materialType required material such as "PLA"
 * @param color required color, "#RRGGBB"
 * @param usedGrams filament mass the job consumes
 * @param fingerprint spool fingerprint recorded at slice time
 * @param targetExtruder extruder the slicer assigned this filament to
 * @since 14/10/2026
 */
public record FilamentRequirement(int slotId,
                                  String materialType,
                                  String color,
                                  double usedGrams,
                                  Optional<String> fingerprint,
                                  OptionalInt targetExtruder) {

    public FilamentRequirement {
        materialType = materialType == null ? "" : materialType;
        color = color == null ? "" : color;
        fingerprint = fingerprint == null ? Optional.empty() : fingerprint.map(String::trim).filter(s -> !s.isEmpty());
        targetExtruder = targetExtruder == null ? OptionalInt.empty() : targetExtruder;
    }

    public static FilamentRequirement of(int slotId, String materialType, String color, double usedGrams) {
        return new FilamentRequirement(slotId, materialType, color, usedGrams, Optional.empty(), OptionalInt.empty());
    }

    public FilamentRequirement withFingerprint(String value) {
        return new FilamentRequirement(slotId, materialType, color, usedGrams, Optional.ofNullable(value), targetExtruder);
    }

    public FilamentRequirement onExtruder(int extruder) {
        return new FilamentRequirement(slotId, materialType, color, usedGrams, fingerprint, OptionalInt.of(extruder));
    }
}
