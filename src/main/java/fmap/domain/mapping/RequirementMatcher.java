package fmap.domain.mapping;

import fmap.common.MappingConstants;
import fmap.dal.MappingConfig;
import fmap.domain.feed.FeedColors;
import fmap.domain.feed.FeedSnapshot;
import fmap.domain.feed.InventoryNormalizer;
import fmap.domain.feed.LoadedFeedEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Resolves the filament requirements of a print job to physical feed slots.
 * <p>
 * Requirements are resolved one by one in list order, each against the slots earlier requirements
 * have not taken. This is a greedy first-come-first-served pass, not a global assignment: a later
 * requirement never takes a slot back from an earlier one, even if that would match more of them.
 * <p>
 * Per requirement:
 * <ol>
 *     <li>a target extruder restricts candidates to slots wired to that extruder, with no fallback</li>
 *     <li>same spool fingerprint (and material)</li>
 *     <li>same material and color</li>
 *     <li>same material and similar color, when a tolerance is configured</li>
 *     <li>same material</li>
 * </ol>
 * Never throws. Stateless; the consumed-slot set lives only for one call.
 *
 * @since 14/10/2026
 */
public class RequirementMatcher {
    private static final Logger logger = LoggerFactory.getLogger(RequirementMatcher.class);

    private final InventoryNormalizer normalizer;
    private final int colorTolerance;

    public RequirementMatcher() {
        this(new InventoryNormalizer(), MappingConstants.DEFAULT_COLOR_TOLERANCE);
    }

    public RequirementMatcher(InventoryNormalizer normalizer, int colorTolerance) {
        this.normalizer = normalizer;
        this.colorTolerance = colorTolerance;
    }

    @Inject
    public RequirementMatcher(InventoryNormalizer normalizer, MappingConfig config) {
        this(normalizer, config.colorTolerance());
    }

    public InventoryNormalizer getNormalizer() {
        return normalizer;
    }

    /**
     * @return one slot id (or -1) per requirement, or empty when there is nothing to assign
     *         (no requirements) or nothing to assign from (no loaded slots)
     */
    public Optional<MappingResult> match(List<FilamentRequirement> requirements, Optional<FeedSnapshot> snapshot) {
        if (requirements == null || requirements.isEmpty()) {
            return Optional.empty();
        }
        List<LoadedFeedEntry> inventory = normalizer.normalize(snapshot);
        if (inventory.isEmpty()) {
            logger.debug("No loaded slots, skipping mapping of {} requirements", requirements.size());
            return Optional.empty();
        }
        MappingResult result = MappingResult.fromOutcomes(resolve(requirements, inventory));
        logger.debug("Mapped {} of {} requirements: {}", result.matchedCount(), result.size(), result);
        return Optional.of(result);
    }

    public Optional<MappingResult> match(List<FilamentRequirement> requirements, FeedSnapshot snapshot) {
        return match(requirements, Optional.ofNullable(snapshot));
    }

    /**
     * Resolve every requirement in order against an already normalized inventory
     */
    public List<MatchOutcome> resolve(List<FilamentRequirement> requirements, List<LoadedFeedEntry> inventory) {
        Set<Integer> consumed = new HashSet<>();
        List<MatchOutcome> outcomes = new ArrayList<>(requirements.size());
        for (FilamentRequirement requirement : requirements) {
            outcomes.add(resolveOne(requirement, inventory, consumed));
        }
        return outcomes;
    }

    /**
     * Resolve a single requirement. A matched slot id is added to {@code consumed}.
     */
    public MatchOutcome resolveOne(FilamentRequirement requirement, List<LoadedFeedEntry> inventory, Set<Integer> consumed) {
        List<LoadedFeedEntry> candidates = inventory.stream()
                .filter(e -> !consumed.contains(e.globalSlotId()))
                .collect(Collectors.toList());

        if (requirement.targetExtruder().isPresent() && hasExtruderInfo(inventory)) {
            int extruder = requirement.targetExtruder().getAsInt();
            candidates = candidates.stream().filter(e -> e.isOnExtruder(extruder)).collect(Collectors.toList());
            if (candidates.isEmpty()) {
                logger.debug("No free slot on extruder {} for filament slot {}", extruder, requirement.slotId());
                return MatchOutcome.unmatched(requirement);
            }
        }

        MatchOutcome outcome = selectCandidate(requirement, candidates);
        outcome.entry().ifPresent(e -> consumed.add(e.globalSlotId()));
        logger.trace("Filament slot {} ({} {}) -> {} via {}", requirement.slotId(), requirement.materialType(),
                requirement.color(), outcome.globalSlotId(), outcome.tier());
        return outcome;
    }

    private MatchOutcome selectCandidate(FilamentRequirement requirement, List<LoadedFeedEntry> candidates) {
        String type = requirement.materialType();
        String color = FeedColors.normalizeForCompare(requirement.color());
        Predicate<LoadedFeedEntry> sameType = e -> e.hasMaterialType(type);
        Predicate<LoadedFeedEntry> sameColor = e -> e.hasColor(color);

        if (requirement.fingerprint().isPresent()) {
            String fingerprint = requirement.fingerprint().get();
            List<LoadedFeedEntry> sameSpool = candidates.stream()
                    .filter(sameType.and(e -> e.hasFingerprint(fingerprint)))
                    .collect(Collectors.toList());
            if (!sameSpool.isEmpty()) {
                // Several spools can share a preset fingerprint; color decides between them
                LoadedFeedEntry pick = sameSpool.stream().filter(sameColor).findFirst().orElse(sameSpool.get(0));
                return MatchOutcome.matched(requirement, pick, EMatchTier.FINGERPRINT);
            }
        }

        Optional<LoadedFeedEntry> exact = firstMatching(candidates, sameType.and(sameColor));
        if (exact.isPresent()) {
            return MatchOutcome.matched(requirement, exact.get(), EMatchTier.COLOR);
        }

        if (colorTolerance > 0) {
            Optional<LoadedFeedEntry> similar = firstMatching(candidates,
                    sameType.and(e -> FeedColors.areSimilar(e.color(), color, colorTolerance)));
            if (similar.isPresent()) {
                return MatchOutcome.matched(requirement, similar.get(), EMatchTier.SIMILAR_COLOR);
            }
        }

        return firstMatching(candidates, sameType)
                .map(e -> MatchOutcome.matched(requirement, e, EMatchTier.TYPE_ONLY))
                .orElseGet(() -> MatchOutcome.unmatched(requirement));
    }

    private static Optional<LoadedFeedEntry> firstMatching(List<LoadedFeedEntry> candidates, Predicate<LoadedFeedEntry> test) {
        return candidates.stream().filter(test).findFirst();
    }

    private static boolean hasExtruderInfo(List<LoadedFeedEntry> inventory) {
        return inventory.stream().anyMatch(e -> e.extruderId().isPresent());
    }
}
