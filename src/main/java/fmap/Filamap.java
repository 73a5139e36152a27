package fmap;

import com.google.inject.Guice;
import com.google.inject.Injector;
import fmap.dal.ConfigurationService;
import fmap.dal.MappingConfig;
import fmap.dal.ServerConfig;
import fmap.domain.mapping.FilamentMappingService;
import fmap.domain.orchestration.WebServerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Filamap filament mapping service
 * @since 15/10/2026
 */
public class Filamap {
    private static final Logger logger = LoggerFactory.getLogger(Filamap.class);

    public static void main(String[] args) {
        logger.info("Starting Filamap filament mapping service...");

        try {
            ConfigurationService configService = new ConfigurationService();

            MappingConfig mappingConfig = configService.getMappingConfiguration();
            ServerConfig serverConfig = configService.getServerConfiguration();

            logger.info("Configuration loaded successfully");
            logger.debug("Mapping: {}", mappingConfig);
            logger.debug("Server: {}", serverConfig);

            Injector injector = Guice.createInjector(new GuiceModule(mappingConfig, serverConfig));

            FilamentMappingService mappingService = injector.getInstance(FilamentMappingService.class);
            mappingService.start();

            WebServerManager webServer = injector.getInstance(WebServerManager.class);
            webServer.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                webServer.stop();
                mappingService.stop();
            }, "shutdown"));

        } catch (Exception e) {
            logger.error("Failed to start application", e);
            System.exit(1);
        }
    }
}
