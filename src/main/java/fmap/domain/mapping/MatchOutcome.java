package fmap.domain.mapping;

import fmap.common.MappingConstants;
import fmap.domain.feed.LoadedFeedEntry;

import java.util.Optional;

/**
 * Resolution of a single requirement
 * @since 14/10/2026
 */
public record MatchOutcome(FilamentRequirement requirement, Optional<LoadedFeedEntry> entry, EMatchTier tier) {

    public static MatchOutcome matched(FilamentRequirement requirement, LoadedFeedEntry entry, EMatchTier tier) {
        return new MatchOutcome(requirement, Optional.of(entry), tier);
    }

    public static MatchOutcome unmatched(FilamentRequirement requirement) {
        return new MatchOutcome(requirement, Optional.empty(), EMatchTier.NONE);
    }

    public int globalSlotId() {
        return entry.map(LoadedFeedEntry::globalSlotId).orElse(MappingConstants.UNMATCHED);
    }
}
