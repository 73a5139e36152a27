package fmap.domain.mapping.review;

import fmap.dal.MappingConfig;
import fmap.domain.feed.FeedColors;
import fmap.domain.feed.FeedSnapshot;
import fmap.domain.feed.LoadedFeedEntry;
import fmap.domain.mapping.EMatchTier;
import fmap.domain.mapping.FilamentRequirement;
import fmap.domain.mapping.MatchOutcome;
import fmap.domain.mapping.RequirementMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Combines operator overrides with the automatic match.
 * <p>
 * Overrides map a job filament slot id to a global slot id. Every override target is reserved before
 * automatic matching starts, so the matcher never hands the same slot to another filament. An override
 * pointing at a slot that is not loaded is ignored and that filament is matched automatically.
 *
 * @since 15/10/2026
 */
public class MappingReviewService {
    private static final Logger logger = LoggerFactory.getLogger(MappingReviewService.class);

    private final RequirementMatcher matcher;
    private final int colorTolerance;

    @Inject
    public MappingReviewService(RequirementMatcher matcher, MappingConfig config) {
        this.matcher = matcher;
        this.colorTolerance = config.colorTolerance();
    }

    public MappingReview review(List<FilamentRequirement> requirements,
                                Optional<FeedSnapshot> snapshot,
                                Map<Integer, Integer> manualOverrides) {
        List<LoadedFeedEntry> inventory = matcher.getNormalizer().normalize(snapshot);
        if (requirements == null || requirements.isEmpty()) {
            return MappingReview.empty(inventory);
        }
        Map<Integer, Integer> overrides = manualOverrides == null ? Map.of() : manualOverrides;

        Set<Integer> consumed = new HashSet<>(overrides.values());
        List<FilamentComparison> comparisons = new ArrayList<>(requirements.size());

        for (FilamentRequirement requirement : requirements) {
            Optional<LoadedFeedEntry> manualEntry = findOverride(requirement, overrides, inventory);
            if (manualEntry.isPresent()) {
                comparisons.add(compareManual(requirement, manualEntry.get()));
            } else {
                comparisons.add(compareAutomatic(matcher.resolveOne(requirement, inventory, consumed)));
            }
        }

        MappingReview review = new MappingReview(comparisons, inventory);
        logger.debug("Reviewed {} filaments with {} overrides: {}", comparisons.size(), overrides.size(),
                review.getSummary().status());
        return review;
    }

    private static Optional<LoadedFeedEntry> findOverride(FilamentRequirement requirement,
                                                          Map<Integer, Integer> overrides,
                                                          List<LoadedFeedEntry> inventory) {
        if (requirement.slotId() <= 0) {
            return Optional.empty();
        }
        Integer target = overrides.get(requirement.slotId());
        if (target == null) {
            return Optional.empty();
        }
        Optional<LoadedFeedEntry> entry = inventory.stream().filter(e -> e.globalSlotId() == target).findFirst();
        if (entry.isEmpty()) {
            logger.warn("Override for filament slot {} points at slot {} which is not loaded", requirement.slotId(), target);
        }
        return entry;
    }

    private FilamentComparison compareManual(FilamentRequirement requirement, LoadedFeedEntry entry) {
        boolean typeMatch = entry.hasMaterialType(requirement.materialType());
        String color = FeedColors.normalizeForCompare(requirement.color());
        boolean colorMatch = entry.hasColor(color) || FeedColors.areSimilar(entry.color(), color, colorTolerance);

        EFilamentStatus status;
        if (typeMatch && colorMatch) {
            status = EFilamentStatus.MATCH;
        } else if (typeMatch) {
            status = EFilamentStatus.TYPE_ONLY;
        } else {
            status = EFilamentStatus.MISMATCH;
        }
        return new FilamentComparison(requirement, Optional.of(entry), EMatchTier.NONE, typeMatch, colorMatch, status, true);
    }

    private static FilamentComparison compareAutomatic(MatchOutcome outcome) {
        EMatchTier tier = outcome.tier();
        EFilamentStatus status;
        if (tier.isColorMatch()) {
            status = EFilamentStatus.MATCH;
        } else if (tier == EMatchTier.TYPE_ONLY) {
            status = EFilamentStatus.TYPE_ONLY;
        } else {
            status = EFilamentStatus.MISMATCH;
        }
        return new FilamentComparison(outcome.requirement(), outcome.entry(), tier, tier.isMatched(),
                tier.isColorMatch(), status, false);
    }
}
