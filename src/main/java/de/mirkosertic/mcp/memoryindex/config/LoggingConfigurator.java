package de.mirkosertic.mcp.memoryindex.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches logging to file-only output when running as a deployed STDIO server.
 * <p>
 * STDOUT carries the MCP JSON-RPC stream, so in deployed mode {@code logback-deployed.xml} replaces the
 * console configuration. The log directory defaults to {@code ~/.memoryindex/log} and can be moved with the
 * {@code memoryindex.log.dir} system property; it is handed to Logback as the {@code LOG_DIR} property.
 * Development mode keeps the automatically loaded {@code logback.xml}.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "memoryindex.log.dir";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Whether the deployed profile was requested on the command line. Read directly from system
     * properties so it can be evaluated before any logger exists.
     */
    public static boolean isDeployedProfileActive() {
        final String profile = System.getProperty("spring.profiles.active", System.getProperty("profile", "default"));
        return "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Must be called before anything logs.
     *
     * @param deployedMode true if running in deployed mode (STDIO transport)
     * @return true if the deployed configuration was applied
     */
    public static boolean configure(final boolean deployedMode) {
        if (!deployedMode) {
            return false;
        }
        final Path logDir = logDirectory();
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
        return loadConfiguration(DEPLOYED_CONFIG, logDir);
    }

    static Path logDirectory() {
        final String configured = System.getProperty(LOG_DIR_PROPERTY);
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured);
        }
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static boolean loadConfiguration(final String configFile, final Path logDir) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return false;
            }
            context.reset();
            context.putProperty("LOG_DIR", logDir.toString());

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
            return false;
        }
    }
}
