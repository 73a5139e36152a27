package fmap.domain.feed;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * One material position as reported by the printer, either inside a feed unit or standing alone
 * as an external feed. A slot without a material type is empty.
 *
 * @param index slot index within its unit (0-3), absent for external feeds
 * @param materialType free-text material label such as "PLA"
 * @param color 6-8 hex digits, optionally prefixed with '#'
 * @param fingerprint identifier stamped on the spool when it was loaded
 * @param subBrand sub-brand label such as "PLA Basic"
 * @since 14/10/2026
 */
public record FeedSlot(OptionalInt index,
                       Optional<String> materialType,
                       Optional<String> color,
                       Optional<String> fingerprint,
                       Optional<String> subBrand) {

    public FeedSlot {
        index = index == null ? OptionalInt.empty() : index;
        materialType = blankToEmpty(materialType);
        color = blankToEmpty(color);
        fingerprint = blankToEmpty(fingerprint);
        subBrand = blankToEmpty(subBrand);
    }

    /**
     * Factory method: slot holding a spool
     */
    public static FeedSlot loaded(int index, String materialType, String color) {
        return new FeedSlot(OptionalInt.of(index), Optional.ofNullable(materialType), Optional.ofNullable(color),
                Optional.empty(), Optional.empty());
    }

    /**
     * Factory method: external feed holding a spool (no index)
     */
    public static FeedSlot external(String materialType, String color) {
        return new FeedSlot(OptionalInt.empty(), Optional.ofNullable(materialType), Optional.ofNullable(color),
                Optional.empty(), Optional.empty());
    }

    /**
     * Factory method: empty slot
     */
    public static FeedSlot empty(int index) {
        return new FeedSlot(OptionalInt.of(index), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public FeedSlot withFingerprint(String value) {
        return new FeedSlot(index, materialType, color, Optional.ofNullable(value), subBrand);
    }

    public FeedSlot withSubBrand(String value) {
        return new FeedSlot(index, materialType, color, fingerprint, Optional.ofNullable(value));
    }

    public boolean isEmpty() {
        return materialType.isEmpty();
    }

    private static Optional<String> blankToEmpty(Optional<String> value) {
        if (value == null) {
            return Optional.empty();
        }
        return value.map(String::trim).filter(s -> !s.isEmpty());
    }
}
