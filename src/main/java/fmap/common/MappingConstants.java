package fmap.common;

/**
 * Feed hardware identifiers and mapping sentinels
 * @since 14/10/2026
 */
public final class MappingConstants {
    private MappingConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final int SLOTS_PER_UNIT = 4;
    public static final int HT_UNIT_ID_BASE = 128;            // High-throughput units are numbered from here

    public static final int EXTERNAL_PRIMARY_ID = 254;        // External spool holder, "Ext-L" when there are two
    public static final int EXTERNAL_SECONDARY_ID = 255;      // Second external spool holder, "Ext-R"
    public static final int EXTERNAL_UNIT_ID = -1;            // Unit id reported for external feeds

    public static final int MAX_JOB_SLOT_ID = 256;            // Highest filament slot a job file may reference
    public static final int UNMATCHED = -1;                   // Requirement could not be resolved

    public static final int DEFAULT_COLOR_TOLERANCE = 40;     // Max per-channel RGB difference for "similar"
    public static final String UNKNOWN_DISPLAY_COLOR = "#808080";
}
