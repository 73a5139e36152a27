package fmap.domain.feed;

import java.util.List;

/**
 * Multi-slot cartridge unit. A unit exposing exactly one slot is a high-throughput unit.
 * @since 14/10/2026
 */
public record FeedUnit(int id, List<FeedSlot> slots) {

    public FeedUnit {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public static FeedUnit of(int id, FeedSlot... slots) {
        return new FeedUnit(id, List.of(slots));
    }

    public boolean isHighThroughput() {
        return slots.size() == 1;
    }
}
