package fmap.domain.mapping;

import fmap.common.MappingConstants;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered slot assignment, one entry per requirement: a global slot id or {@link #UNMATCHED}
 * @since 14/10/2026
 */
public final class MappingResult {
    public static final int UNMATCHED = MappingConstants.UNMATCHED;

    private final List<Integer> slotIds;

    private MappingResult(List<Integer> slotIds) {
        this.slotIds = List.copyOf(slotIds);
    }

    public static MappingResult of(List<Integer> slotIds) {
        return new MappingResult(slotIds);
    }

    static MappingResult fromOutcomes(List<MatchOutcome> outcomes) {
        return new MappingResult(outcomes.stream().map(MatchOutcome::globalSlotId).collect(Collectors.toList()));
    }

    public List<Integer> slotIds() {
        return slotIds;
    }

    public int get(int index) {
        return slotIds.get(index);
    }

    public int size() {
        return slotIds.size();
    }

    public boolean isMatched(int index) {
        return slotIds.get(index) != UNMATCHED;
    }

    public long matchedCount() {
        return slotIds.stream().filter(id -> id != UNMATCHED).count();
    }

    public int[] toArray() {
        return slotIds.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return slotIds.equals(((MappingResult) o).slotIds);
    }

    @Override
    public int hashCode() {
        return slotIds.hashCode();
    }

    @Override
    public String toString() {
        return "MappingResult" + slotIds;
    }
}
