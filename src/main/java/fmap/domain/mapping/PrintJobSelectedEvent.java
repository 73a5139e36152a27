package fmap.domain.mapping;

import java.util.List;

/**
 * Posted when a print job is selected for a printer
 * @since 14/10/2026
 */
public class PrintJobSelectedEvent {
    private final int                       printerId;
    private final List<FilamentRequirement> requirements;
    private final long                      timestamp;

    public PrintJobSelectedEvent(int printerId, List<FilamentRequirement> requirements) {
        this.printerId = printerId;
        this.requirements = requirements == null ? List.of() : List.copyOf(requirements);
        this.timestamp = System.currentTimeMillis();
    }

    public int getPrinterId() {
        return printerId;
    }

    public List<FilamentRequirement> getRequirements() {
        return requirements;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "PrintJobSelectedEvent [printerId=" + printerId + ", filaments=" + requirements.size()
                + ", timestamp=" + timestamp + "]";
    }
}
