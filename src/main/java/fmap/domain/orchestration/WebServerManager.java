package fmap.domain.orchestration;

import com.google.common.eventbus.EventBus;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import fmap.dal.MappingConfig;
import fmap.dal.ServerConfig;
import fmap.domain.ApiResponse;
import fmap.domain.mapping.FilamentMappingService;
import fmap.domain.mapping.MappingController;
import fmap.domain.mapping.RequirementMatcher;
import fmap.domain.mapping.review.MappingReviewService;
import io.javalin.Javalin;
import io.javalin.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.lang.reflect.Type;
import java.util.Map;

import static io.javalin.apibuilder.ApiBuilder.get;

/**
 * Manages web server (Javalin) configuration and lifecycle
 * @since 15/10/2026
 */
public class WebServerManager {
    private static final Logger logger = LoggerFactory.getLogger(WebServerManager.class);

    private final ServerConfig serverConfig;
    private final MappingConfig mappingConfig;
    private final RequirementMatcher matcher;
    private final MappingReviewService reviewService;
    private final FilamentMappingService mappingService;
    private final EventBus eventBus;
    private final Gson gson;

    private Javalin javalinApp;

    @Inject
    public WebServerManager(ServerConfig serverConfig,
                            MappingConfig mappingConfig,
                            RequirementMatcher matcher,
                            MappingReviewService reviewService,
                            FilamentMappingService mappingService,
                            EventBus eventBus) {
        this.serverConfig = serverConfig;
        this.mappingConfig = mappingConfig;
        this.matcher = matcher;
        this.reviewService = reviewService;
        this.mappingService = mappingService;
        this.eventBus = eventBus;
        this.gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    }

    /**
     * Start web server
     */
    public void start() {
        logger.info("Starting web server on {}:{}...", serverConfig.host(), serverConfig.port());
        javalinApp = createJavalinApp();
        logger.info("Web server started successfully");
    }

    /**
     * Stop web server
     */
    public void stop() {
        if (javalinApp != null) {
            javalinApp.stop();
            javalinApp = null;
        }
    }

    private Javalin createJavalinApp() {
        Javalin app = Javalin.create(config -> {
            config.jsonMapper(createGsonMapper());

            config.bundledPlugins.enableCors(cors -> cors.addRule(corsRule -> {
                corsRule.anyHost();
                corsRule.allowCredentials = false;
            }));

            config.router.apiBuilder(() -> {
                get("/api/health", ctx -> ctx.json(ApiResponse.success(Map.of(
                        "status", "UP",
                        "htSlotIdConvention", mappingConfig.htSlotIdConvention().name(),
                        "colorTolerance", mappingConfig.colorTolerance()))));

                MappingController mappingController = new MappingController(matcher, reviewService, mappingService, eventBus);
                mappingController.registerRoutes();
            });
        });

        app.exception(Exception.class, (exception, ctx) -> {
            logger.error("Unhandled exception", exception);
            ctx.status(500).json(ApiResponse.error("Internal server error: " + exception.getMessage()));
        });

        return app.start(serverConfig.host(), serverConfig.port());
    }

    private JsonMapper createGsonMapper() {
        return new JsonMapper() {
            @Override
            public String toJsonString(Object obj, Type type) {
                return gson.toJson(obj, type);
            }

            @Override
            public <T> T fromJsonString(String json, Type targetType) {
                return gson.fromJson(json, targetType);
            }
        };
    }
}
