package fmap.domain.mapping.review;

import fmap.common.MappingConstants;
import fmap.domain.feed.LoadedFeedEntry;
import fmap.domain.mapping.MappingResult;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Proposed assignment for a job on one printer, including operator overrides
 * @since 15/10/2026
 */
public final class MappingReview {
    private final List<FilamentComparison> comparisons;
    private final List<LoadedFeedEntry> inventory;

    MappingReview(List<FilamentComparison> comparisons, List<LoadedFeedEntry> inventory) {
        this.comparisons = List.copyOf(comparisons);
        this.inventory = List.copyOf(inventory);
    }

    static MappingReview empty(List<LoadedFeedEntry> inventory) {
        return new MappingReview(List.of(), inventory);
    }

    public List<FilamentComparison> getComparisons() {
        return comparisons;
    }

    public List<LoadedFeedEntry> getInventory() {
        return inventory;
    }

    /**
     * Final slot per requirement in requirement order, empty when there is nothing to assign or nothing loaded
     */
    public Optional<MappingResult> getMapping() {
        if (comparisons.isEmpty() || inventory.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(MappingResult.of(
                comparisons.stream().map(FilamentComparison::globalSlotId).collect(Collectors.toList())));
    }

    /**
     * Mapping laid out the way the print command expects it: index {@code slotId - 1} holds the
     * slot for that job filament, unused positions hold -1. Slot ids above
     * {@link MappingConstants#MAX_JOB_SLOT_ID} are left out.
     */
    public Optional<int[]> getPrintCommandMapping() {
        int maxSlotId = comparisons.stream()
                .mapToInt(c -> c.requirement().slotId())
                .filter(id -> id <= MappingConstants.MAX_JOB_SLOT_ID)
                .max().orElse(0);
        if (maxSlotId <= 0) {
            return Optional.empty();
        }
        int[] mapping = new int[maxSlotId];
        Arrays.fill(mapping, MappingConstants.UNMATCHED);
        for (FilamentComparison comparison : comparisons) {
            int slotId = comparison.requirement().slotId();
            if (slotId > 0 && slotId <= maxSlotId) {
                mapping[slotId - 1] = comparison.globalSlotId();
            }
        }
        return Optional.of(mapping);
    }

    public boolean hasTypeMismatch() {
        return comparisons.stream().anyMatch(c -> c.status() == EFilamentStatus.MISMATCH);
    }

    public boolean hasColorMismatch() {
        return comparisons.stream().anyMatch(c -> c.status() == EFilamentStatus.TYPE_ONLY);
    }

    public PrinterMatchSummary getSummary() {
        return PrinterMatchSummary.of(comparisons);
    }
}
