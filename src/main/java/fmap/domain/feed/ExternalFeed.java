package fmap.domain.feed;

/**
 * Spool holder that does not belong to any feed unit
 * @param positionId fixed hardware position (254 primary, 255 secondary)
 * @since 14/10/2026
 */
public record ExternalFeed(int positionId, FeedSlot slot) {

    public ExternalFeed {
        if (slot == null) {
            slot = new FeedSlot(null, null, null, null, null);
        }
    }
}
