package fmap.domain.mapping;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import fmap.domain.feed.FeedSnapshot;
import fmap.domain.feed.FeedSnapshotEvent;
import fmap.domain.feed.IFeedSnapshotProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every printer's proposed slot mapping current.
 * <p>
 * Listens for new telemetry and newly selected jobs, recomputes the mapping from scratch on every
 * change and posts a {@link MappingUpdatedEvent}. The last snapshot, job and result per printer
 * are cached here; the matcher itself holds nothing between calls.
 *
 * @since 14/10/2026
 */
@Singleton
public class FilamentMappingService {
    private static final Logger logger = LoggerFactory.getLogger(FilamentMappingService.class);

    private final RequirementMatcher matcher;
    private final EventBus eventBus;
    private final IFeedSnapshotProvider snapshotProvider;
    private final IRequirementSource requirementSource;

    private final Map<Integer, FeedSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<Integer, List<FilamentRequirement>> jobs = new ConcurrentHashMap<>();
    private final Map<Integer, MappingResult> results = new ConcurrentHashMap<>();
    private final Map<Integer, Object> printerLocks = new ConcurrentHashMap<>();

    @Inject
    public FilamentMappingService(RequirementMatcher matcher,
                                  EventBus eventBus,
                                  IFeedSnapshotProvider snapshotProvider,
                                  IRequirementSource requirementSource) {
        this.matcher = matcher;
        this.eventBus = eventBus;
        this.snapshotProvider = snapshotProvider;
        this.requirementSource = requirementSource;
    }

    /**
     * Subscribe to snapshot and job events
     */
    public void start() {
        eventBus.register(this);
        logger.info("Filament mapping service listening for printer events");
    }

    public void stop() {
        eventBus.unregister(this);
    }

    @Subscribe
    public void onFeedSnapshot(FeedSnapshotEvent event) {
        logger.debug("Received {}", event);
        snapshots.put(event.getPrinterId(), event.getSnapshot());
        recompute(event.getPrinterId());
    }

    @Subscribe
    public void onPrintJobSelected(PrintJobSelectedEvent event) {
        logger.debug("Received {}", event);
        jobs.put(event.getPrinterId(), event.getRequirements());
        recompute(event.getPrinterId());
    }

    /**
     * Load a job through the requirement source and select it for a printer
     */
    public void selectJob(int printerId, String jobId) {
        List<FilamentRequirement> requirements = requirementSource.getRequirements(jobId);
        logger.info("Selected job '{}' with {} filaments for printer {}", jobId, requirements.size(), printerId);
        eventBus.post(new PrintJobSelectedEvent(printerId, requirements));
    }

    public void clearJob(int printerId) {
        jobs.remove(printerId);
        recompute(printerId);
    }

    public Optional<MappingResult> getMapping(int printerId) {
        return Optional.ofNullable(results.get(printerId));
    }

    public Optional<FeedSnapshot> getSnapshot(int printerId) {
        FeedSnapshot cached = snapshots.get(printerId);
        if (cached != null) {
            return Optional.of(cached);
        }
        return snapshotProvider.getSnapshot(printerId);
    }

    public List<FilamentRequirement> getRequirements(int printerId) {
        return jobs.getOrDefault(printerId, List.of());
    }

    /**
     * Serialized per printer: inputs are read inside the lock, so the last recompute to finish
     * always sees the latest snapshot and job.
     */
    private void recompute(int printerId) {
        Object lock = printerLocks.computeIfAbsent(printerId, id -> new Object());
        synchronized (lock) {
            Optional<MappingResult> mapping = matcher.match(getRequirements(printerId), getSnapshot(printerId));
            if (mapping.isPresent()) {
                results.put(printerId, mapping.get());
            } else {
                results.remove(printerId);
            }
            eventBus.post(new MappingUpdatedEvent(printerId, mapping));
        }
    }
}
