package fmap.domain.mapping;

import java.util.Optional;

/**
 * Posted after the mapping of a printer has been recomputed
 * @since 14/10/2026
 */
public class MappingUpdatedEvent {
    private final int                     printerId;
    private final Optional<MappingResult> mapping;
    private final long                    timestamp;

    public MappingUpdatedEvent(int printerId, Optional<MappingResult> mapping) {
        this.printerId = printerId;
        this.mapping = mapping;
        this.timestamp = System.currentTimeMillis();
    }

    public int getPrinterId() {
        return printerId;
    }

    public Optional<MappingResult> getMapping() {
        return mapping;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "MappingUpdatedEvent [printerId=" + printerId + ", mapping=" + mapping.map(MappingResult::toString).orElse("none")
                + ", timestamp=" + timestamp + "]";
    }
}
