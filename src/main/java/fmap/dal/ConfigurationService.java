package fmap.dal;

import fmap.common.EHtSlotIdConvention;
import fmap.common.MappingConstants;
import fmap.common.ServerConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main configuration service - entry point for all configuration needs
 * @since 14/10/2026
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private final MappingConfig mappingConfig;
    private final ServerConfig serverConfig;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        this.mappingConfig = loadMappingConfiguration();
        this.serverConfig = loadServerConfiguration();
    }

    /**
     * Load matcher configuration
     */
    private MappingConfig loadMappingConfiguration() throws ConfigurationException {
        String conventionStr = loader.getString("mapping.ht.slot.id.convention", EHtSlotIdConvention.UNIT_ID.name());
        EHtSlotIdConvention convention;
        try {
            convention = EHtSlotIdConvention.valueOf(conventionStr.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid high-throughput slot id convention '{}', defaulting to UNIT_ID", conventionStr);
            convention = EHtSlotIdConvention.UNIT_ID;
        }

        int tolerance = loader.getInt("mapping.color.tolerance", MappingConstants.DEFAULT_COLOR_TOLERANCE);

        MappingConfig config = new MappingConfig(convention, tolerance);
        config.validate();
        logger.info("Configured mapping: {}", config);
        return config;
    }

    /**
     * Load server configuration
     */
    private ServerConfig loadServerConfiguration() throws ConfigurationException {
        int port = loader.getInt("server.port", ServerConstants.SERVER_PORT);
        String host = loader.getString("server.host", ServerConstants.SERVER_IP);

        ServerConfig config = new ServerConfig(port, host);
        config.validate();
        return config;
    }

    public MappingConfig getMappingConfiguration() {
        return mappingConfig;
    }

    public ServerConfig getServerConfiguration() {
        return serverConfig;
    }
}
