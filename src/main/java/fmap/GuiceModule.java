package fmap;

import com.google.common.eventbus.EventBus;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import fmap.dal.MappingConfig;
import fmap.dal.ServerConfig;
import fmap.domain.feed.IFeedSnapshotProvider;
import fmap.domain.feed.NoOpFeedSnapshotProvider;
import fmap.domain.mapping.IRequirementSource;
import fmap.domain.mapping.NoOpRequirementSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires configuration, the event bus and the external collaborators
 * @since 15/10/2026
 */
public class GuiceModule extends AbstractModule {
    private static final Logger logger = LoggerFactory.getLogger(GuiceModule.class);

    private final MappingConfig mappingConfig;
    private final ServerConfig serverConfig;

    public GuiceModule(MappingConfig mappingConfig, ServerConfig serverConfig) {
        this.mappingConfig = mappingConfig;
        this.serverConfig = serverConfig;
    }

    @Override
    protected void configure() {
        bind(MappingConfig.class).toInstance(mappingConfig);
        bind(ServerConfig.class).toInstance(serverConfig);

        // No telemetry poller or job parser in this process; data arrives over REST
        bind(IFeedSnapshotProvider.class).to(NoOpFeedSnapshotProvider.class);
        bind(IRequirementSource.class).to(NoOpRequirementSource.class);
    }

    /**
     * Single bus shared by the REST layer and the mapping service
     */
    @Provides
    @Singleton
    public EventBus provideEventBus() {
        return new EventBus((exception, context) ->
                logger.error("Event handler {} failed for {}", context.getSubscriberMethod().getName(),
                        context.getEvent(), exception));
    }
}
