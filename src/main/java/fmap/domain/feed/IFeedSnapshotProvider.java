package fmap.domain.feed;

import java.util.Optional;

/**
 * Source of the latest feed hardware snapshot for a printer (telemetry poller)
 * @since 14/10/2026
 */
public interface IFeedSnapshotProvider {
    Optional<FeedSnapshot> getSnapshot(int printerId);
}
