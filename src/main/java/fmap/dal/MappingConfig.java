package fmap.dal;

import fmap.common.EHtSlotIdConvention;
import fmap.common.MappingConstants;

/**
 * Type-safe configuration for the filament-to-tray matcher
 *
 * @param htSlotIdConvention global id convention for single-slot (high-throughput) units
 * @param colorTolerance max per-channel RGB difference for the similar-color tier, 0 disables the tier
 * @since 14/10/2026
 */
public record MappingConfig(EHtSlotIdConvention htSlotIdConvention, int colorTolerance) {

    public static MappingConfig defaults() {
        return new MappingConfig(EHtSlotIdConvention.UNIT_ID, MappingConstants.DEFAULT_COLOR_TOLERANCE);
    }

    public boolean isSimilarColorEnabled() {
        return colorTolerance > 0;
    }

    public void validate() throws ConfigurationException {
        if (htSlotIdConvention == null) {
            throw new ConfigurationException("High-throughput slot id convention cannot be null");
        }
        if (colorTolerance < 0 || colorTolerance > 255) {
            throw new ConfigurationException("Color tolerance must be between 0 and 255");
        }
    }

    @Override
    public String toString() {
        return String.format("MappingConfiguration{htSlotIds=%s, colorTolerance=%d}", htSlotIdConvention, colorTolerance);
    }
}
