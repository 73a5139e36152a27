package fmap.domain.feed;

import fmap.common.EHtSlotIdConvention;
import fmap.common.MappingConstants;
import fmap.dal.MappingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Flattens a {@link FeedSnapshot} into the list of loaded slots the matcher works on.
 * <p>
 * Unit slots come first (unit order, then slot order), external feeds last. Empty slots are skipped.
 * Stateless; a single instance may be shared between threads.
 *
 * @since 14/10/2026
 */
public class InventoryNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(InventoryNormalizer.class);

    private final EHtSlotIdConvention htConvention;

    public InventoryNormalizer() {
        this(EHtSlotIdConvention.UNIT_ID);
    }

    public InventoryNormalizer(EHtSlotIdConvention htConvention) {
        this.htConvention = htConvention;
    }

    @Inject
    public InventoryNormalizer(MappingConfig config) {
        this(config.htSlotIdConvention());
    }

    public EHtSlotIdConvention getHtConvention() {
        return htConvention;
    }

    public List<LoadedFeedEntry> normalize(FeedSnapshot snapshot) {
        return normalize(Optional.ofNullable(snapshot));
    }

    public List<LoadedFeedEntry> normalize(Optional<FeedSnapshot> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return List.of();
        }
        FeedSnapshot status = snapshot.get();
        Optional<ExtruderTopology> topology = status.topology();

        List<LoadedFeedEntry> entries = new ArrayList<>();
        Set<Integer> seenIds = new HashSet<>();

        for (FeedUnit unit : status.units()) {
            boolean highThroughput = unit.isHighThroughput();
            OptionalInt extruder = topology.map(t -> t.extruderForUnit(unit.id())).orElse(OptionalInt.empty());

            List<FeedSlot> slots = unit.slots();
            for (int position = 0; position < slots.size(); position++) {
                FeedSlot slot = slots.get(position);
                if (slot.isEmpty()) {
                    continue;
                }
                int slotIndex = slot.index().orElse(position);
                if (slotIndex < 0) {
                    logger.warn("Ignoring slot with negative index {} in unit {}", slotIndex, unit.id());
                    continue;
                }
                int globalId = SlotIdentifiers.unitSlotId(unit.id(), slotIndex, highThroughput, htConvention);
                String label = SlotIdentifiers.unitSlotLabel(unit.id(), slotIndex, highThroughput);
                addUnique(entries, seenIds, toEntry(slot, unit.id(), slotIndex, globalId, false, highThroughput, extruder, label));
            }
        }

        boolean dualExternal = status.externals().size() > 1;
        for (ExternalFeed feed : status.externals()) {
            FeedSlot slot = feed.slot();
            if (slot.isEmpty()) {
                continue;
            }
            int positionId = feed.positionId();
            OptionalInt extruder = topology.map(t -> t.extruderForExternal(positionId)).orElse(OptionalInt.empty());
            String label = SlotIdentifiers.externalLabel(positionId, dualExternal);
            int offset = positionId - MappingConstants.EXTERNAL_PRIMARY_ID;
            addUnique(entries, seenIds, toEntry(slot, MappingConstants.EXTERNAL_UNIT_ID, offset, positionId,
                    true, false, extruder, label));
        }

        logger.trace("Normalized {} loaded slots from {} units and {} external feeds",
                entries.size(), status.units().size(), status.externals().size());
        return List.copyOf(entries);
    }

    private static LoadedFeedEntry toEntry(FeedSlot slot, int unitId, int slotIndex, int globalId, boolean external,
                                           boolean highThroughput, OptionalInt extruder, String label) {
        String rawColor = slot.color().orElse(null);
        return new LoadedFeedEntry(
                slot.materialType().orElse(""),
                FeedColors.normalizeForCompare(rawColor),
                FeedColors.normalizeForDisplay(rawColor),
                unitId,
                slotIndex,
                globalId,
                slot.fingerprint().orElse(""),
                external,
                highThroughput,
                extruder,
                slot.subBrand().orElse(""),
                label);
    }

    private static void addUnique(List<LoadedFeedEntry> entries, Set<Integer> seenIds, LoadedFeedEntry entry) {
        if (!seenIds.add(entry.globalSlotId())) {
            logger.warn("Duplicate global slot id {} ({}), keeping the first occurrence", entry.globalSlotId(), entry.label());
            return;
        }
        entries.add(entry);
    }
}
