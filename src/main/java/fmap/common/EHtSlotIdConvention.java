package fmap.common;

/**
 * How a high-throughput (single slot) unit is turned into a global slot id.
 * Only units numbered from 128 up use {@link #UNIT_ID}; lower single-slot units keep the regular formula.
 * @since 14/10/2026
 */
public enum EHtSlotIdConvention {
    UNIT_ID,        // The unit id is the global id (unit 128 -> 128)
    SLOT_FORMULA    // Same formula as regular units (unit 128 -> 128 * 4 + 0 = 512)
}
