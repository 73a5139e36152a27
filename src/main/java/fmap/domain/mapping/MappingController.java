package fmap.domain.mapping;

import com.google.common.eventbus.EventBus;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fmap.domain.ApiResponse;
import fmap.domain.codec.FeedParseException;
import fmap.domain.codec.FeedSnapshotParser;
import fmap.domain.codec.RequirementParser;
import fmap.domain.feed.FeedSnapshot;
import fmap.domain.feed.FeedSnapshotEvent;
import fmap.domain.feed.LoadedFeedEntry;
import fmap.domain.mapping.review.FilamentComparison;
import fmap.domain.mapping.review.MappingReview;
import fmap.domain.mapping.review.MappingReviewService;
import fmap.domain.mapping.review.PrinterMatchSummary;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

/**
 * REST API Controller for filament mapping
 * @since 15/10/2026
 */
public class MappingController {
    private static final Logger logger = LoggerFactory.getLogger(MappingController.class);

    private final RequirementMatcher matcher;
    private final MappingReviewService reviewService;
    private final FilamentMappingService mappingService;
    private final EventBus eventBus;
    private final FeedSnapshotParser snapshotParser;
    private final RequirementParser requirementParser;

    public MappingController(RequirementMatcher matcher,
                             MappingReviewService reviewService,
                             FilamentMappingService mappingService,
                             EventBus eventBus) {
        this.matcher = matcher;
        this.reviewService = reviewService;
        this.mappingService = mappingService;
        this.eventBus = eventBus;
        this.snapshotParser = new FeedSnapshotParser();
        this.requirementParser = new RequirementParser();
    }

    /**
     * Register all REST API routes
     */
    public void registerRoutes() {
        path("/api/mapping", () -> {
            post("/resolve", this::resolve);
            post("/review", this::review);
            path("/printers/{id}", () -> {
                get("", this::getPrinterMapping);
                post("/status", this::updatePrinterStatus);
                post("/job", this::selectPrinterJob);
            });
        });
    }

    /**
     * One-shot mapping: body {"status": {...}, "filaments": [...]}
     */
    private void resolve(Context ctx) {
        try {
            JsonObject body = parseBody(ctx.body());
            List<FilamentRequirement> requirements = requirementParser.fromJson(body.get("filaments"));
            Optional<FeedSnapshot> snapshot = readSnapshot(body);

            Optional<MappingResult> mapping = matcher.match(requirements, snapshot);
            if (mapping.isEmpty()) {
                ctx.json(ApiResponse.success("Nothing to map", new MappingResponse(null)));
                return;
            }
            ctx.json(ApiResponse.success(new MappingResponse(mapping.get().slotIds())));

        } catch (FeedParseException e) {
            logger.warn("Rejected mapping request: {}", e.getMessage());
            ctx.status(400).json(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Unexpected error during mapping", e);
            ctx.status(500).json(ApiResponse.error("Mapping failed: " + e.getMessage()));
        }
    }

    /**
     * Mapping with operator overrides: body {"status": {...}, "filaments": [...], "manual": {"1": 254}}
     */
    private void review(Context ctx) {
        try {
            JsonObject body = parseBody(ctx.body());
            List<FilamentRequirement> requirements = requirementParser.fromJson(body.get("filaments"));
            Optional<FeedSnapshot> snapshot = readSnapshot(body);
            Map<Integer, Integer> overrides = readOverrides(body.get("manual"));

            MappingReview review = reviewService.review(requirements, snapshot, overrides);
            ctx.json(ApiResponse.success(ReviewResponse.from(review)));

        } catch (FeedParseException e) {
            logger.warn("Rejected review request: {}", e.getMessage());
            ctx.status(400).json(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Unexpected error during mapping review", e);
            ctx.status(500).json(ApiResponse.error("Review failed: " + e.getMessage()));
        }
    }

    private void getPrinterMapping(Context ctx) {
        Optional<Integer> printerId = readPrinterId(ctx);
        if (printerId.isEmpty()) {
            return;
        }
        Optional<MappingResult> mapping = mappingService.getMapping(printerId.get());
        if (mapping.isEmpty()) {
            ctx.status(404).json(ApiResponse.error("No mapping available for printer " + printerId.get()));
            return;
        }
        ctx.json(ApiResponse.success(new MappingResponse(mapping.get().slotIds())));
    }

    private void updatePrinterStatus(Context ctx) {
        Optional<Integer> printerId = readPrinterId(ctx);
        if (printerId.isEmpty()) {
            return;
        }
        try {
            FeedSnapshot snapshot = snapshotParser.parse(ctx.body());
            eventBus.post(new FeedSnapshotEvent(printerId.get(), snapshot));
            ctx.json(ApiResponse.success("Status accepted"));
        } catch (FeedParseException e) {
            logger.warn("Rejected status for printer {}: {}", printerId.get(), e.getMessage());
            ctx.status(400).json(ApiResponse.error(e.getMessage()));
        }
    }

    private void selectPrinterJob(Context ctx) {
        Optional<Integer> printerId = readPrinterId(ctx);
        if (printerId.isEmpty()) {
            return;
        }
        try {
            List<FilamentRequirement> requirements = requirementParser.parse(ctx.body());
            eventBus.post(new PrintJobSelectedEvent(printerId.get(), requirements));
            ctx.json(ApiResponse.success("Job accepted"));
        } catch (FeedParseException e) {
            logger.warn("Rejected job for printer {}: {}", printerId.get(), e.getMessage());
            ctx.status(400).json(ApiResponse.error(e.getMessage()));
        }
    }

    private Optional<Integer> readPrinterId(Context ctx) {
        try {
            return Optional.of(Integer.parseInt(ctx.pathParam("id")));
        } catch (NumberFormatException e) {
            ctx.status(400).json(ApiResponse.error("Invalid printer id: " + ctx.pathParam("id")));
            return Optional.empty();
        }
    }

    private static JsonObject parseBody(String body) throws FeedParseException {
        try {
            JsonElement root = JsonParser.parseString(body == null ? "" : body);
            if (!root.isJsonObject()) {
                throw new FeedParseException("Request body must be a JSON object");
            }
            return root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new FeedParseException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    private Optional<FeedSnapshot> readSnapshot(JsonObject body) {
        JsonElement status = body.get("status");
        if (status == null || !status.isJsonObject()) {
            return Optional.empty();
        }
        return Optional.of(snapshotParser.fromJson(status.getAsJsonObject()));
    }

    private static Map<Integer, Integer> readOverrides(JsonElement manual) throws FeedParseException {
        Map<Integer, Integer> overrides = new LinkedHashMap<>();
        if (manual == null || !manual.isJsonObject()) {
            return overrides;
        }
        for (Map.Entry<String, JsonElement> entry : manual.getAsJsonObject().entrySet()) {
            try {
                overrides.put(Integer.parseInt(entry.getKey().trim()), entry.getValue().getAsInt());
            } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
                throw new FeedParseException("Invalid manual override '" + entry.getKey() + "'", e);
            }
        }
        return overrides;
    }

    public static class MappingResponse {
        private final List<Integer> mapping;

        public MappingResponse(List<Integer> mapping) {
            this.mapping = mapping;
        }

        public List<Integer> getMapping() {
            return mapping;
        }
    }

    public static class SlotView {
        private final int globalSlotId;
        private final String label;
        private final String materialType;
        private final String color;
        private final String subBrand;
        private final boolean external;
        private final boolean highThroughput;
        private final Integer extruderId;

        SlotView(LoadedFeedEntry entry) {
            this.globalSlotId = entry.globalSlotId();
            this.label = entry.label();
            this.materialType = entry.materialType();
            this.color = entry.displayColor();
            this.subBrand = entry.subBrand();
            this.external = entry.external();
            this.highThroughput = entry.highThroughput();
            this.extruderId = entry.extruderId().isPresent() ? entry.extruderId().getAsInt() : null;
        }
    }

    public static class ComparisonView {
        private final int slotId;
        private final String type;
        private final String color;
        private final double usedGrams;
        private final SlotView loaded;
        private final String status;
        private final boolean typeMatch;
        private final boolean colorMatch;
        private final boolean manual;

        ComparisonView(FilamentComparison comparison) {
            FilamentRequirement requirement = comparison.requirement();
            this.slotId = requirement.slotId();
            this.type = requirement.materialType();
            this.color = requirement.color();
            this.usedGrams = requirement.usedGrams();
            this.loaded = comparison.loaded().map(SlotView::new).orElse(null);
            this.status = comparison.status().name();
            this.typeMatch = comparison.typeMatch();
            this.colorMatch = comparison.colorMatch();
            this.manual = comparison.manual();
        }
    }

    public static class ReviewResponse {
        private final List<SlotView> loadedFilaments;
        private final List<ComparisonView> filamentComparison;
        private final List<Integer> mapping;
        private final List<Integer> printCommandMapping;
        private final boolean hasTypeMismatch;
        private final boolean hasColorMismatch;
        private final String matchStatus;
        private final PrinterMatchSummary summary;

        private ReviewResponse(MappingReview review) {
            this.loadedFilaments = review.getInventory().stream().map(SlotView::new).collect(Collectors.toList());
            this.filamentComparison = review.getComparisons().stream().map(ComparisonView::new).collect(Collectors.toList());
            this.mapping = review.getMapping().map(MappingResult::slotIds).orElse(null);
            this.printCommandMapping = review.getPrintCommandMapping()
                    .map(array -> Arrays.stream(array).boxed().collect(Collectors.toList()))
                    .orElse(null);
            this.hasTypeMismatch = review.hasTypeMismatch();
            this.hasColorMismatch = review.hasColorMismatch();
            this.summary = review.getSummary();
            this.matchStatus = summary.status().name();
        }

        static ReviewResponse from(MappingReview review) {
            return new ReviewResponse(review);
        }
    }
}
