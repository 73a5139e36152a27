package fmap.domain.feed;

/**
 * Posted whenever fresh feed telemetry arrives for a printer
 * @since 14/10/2026
 */
public class FeedSnapshotEvent {
    private final int          printerId;
    private final FeedSnapshot snapshot;
    private final long         timestamp;

    public FeedSnapshotEvent(int printerId, FeedSnapshot snapshot) {
        this.printerId = printerId;
        this.snapshot = snapshot;
        this.timestamp = System.currentTimeMillis();
    }

    public int getPrinterId() {
        return printerId;
    }

    public FeedSnapshot getSnapshot() {
        return snapshot;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "FeedSnapshotEvent [printerId=" + printerId + ", units=" + snapshot.units().size()
                + ", externals=" + snapshot.externals().size() + ", timestamp=" + timestamp + "]";
    }
}
