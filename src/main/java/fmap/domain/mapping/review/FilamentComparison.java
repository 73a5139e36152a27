package fmap.domain.mapping.review;

import fmap.common.MappingConstants;
import fmap.domain.feed.LoadedFeedEntry;
import fmap.domain.mapping.EMatchTier;
import fmap.domain.mapping.FilamentRequirement;

import java.util.Optional;

/**
 * A requirement next to the slot proposed for it
 *
 * @param tier rule that selected the slot, {@link EMatchTier#NONE} for manual picks and misses
 * @param manual slot was chosen by the operator rather than the matcher
 * @since 15/10/2026
 */
public record FilamentComparison(FilamentRequirement requirement,
                                 Optional<LoadedFeedEntry> loaded,
                                 EMatchTier tier,
                                 boolean typeMatch,
                                 boolean colorMatch,
                                 EFilamentStatus status,
                                 boolean manual) {

    public boolean hasFilament() {
        return loaded.isPresent();
    }

    public int globalSlotId() {
        return loaded.map(LoadedFeedEntry::globalSlotId).orElse(MappingConstants.UNMATCHED);
    }
}
