package fmap.domain.feed;

import java.util.Optional;

/**
 * Used when no telemetry poller is wired in; snapshots then only arrive through events.
 * @since 14/10/2026
 */
public class NoOpFeedSnapshotProvider implements IFeedSnapshotProvider {
    @Override
    public Optional<FeedSnapshot> getSnapshot(int printerId) {
        return Optional.empty();
    }
}
