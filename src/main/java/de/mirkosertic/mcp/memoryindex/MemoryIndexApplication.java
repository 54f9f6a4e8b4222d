package de.mirkosertic.mcp.memoryindex;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.memoryindex.config.ApplicationConfig;
import de.mirkosertic.mcp.memoryindex.config.LoggingConfigurator;
import de.mirkosertic.mcp.memoryindex.index.ExactTokenIndex;
import de.mirkosertic.mcp.memoryindex.index.IndexBackend;
import de.mirkosertic.mcp.memoryindex.index.SegmentedTokenIndex;
import de.mirkosertic.mcp.memoryindex.ingest.IngestionService;
import de.mirkosertic.mcp.memoryindex.ingest.RebuildResult;
import de.mirkosertic.mcp.memoryindex.search.FuzzyVariantGenerator;
import de.mirkosertic.mcp.memoryindex.search.QueryPlanner;
import de.mirkosertic.mcp.memoryindex.search.ScoreNormalizer;
import de.mirkosertic.mcp.memoryindex.search.SearchService;
import de.mirkosertic.mcp.memoryindex.store.ContentStore;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point of the memory index.
 * Wires the content store, both indexes and the search core, and serves them as MCP tools over STDIO.
 */
public class MemoryIndexApplication {

    private static final Logger logger = LoggerFactory.getLogger(MemoryIndexApplication.class);

    private final ContentStore contentStore;
    private final ExactTokenIndex exactIndex;
    private final SegmentedTokenIndex segmentedIndex;
    private final IngestionService ingestionService;
    private final SearchService searchService;
    private final MemoryIndexTools tools;
    private McpSyncServer mcpServer;

    public MemoryIndexApplication(final ApplicationConfig config) {
        final Path indexRoot = Paths.get(config.getIndexPath());

        this.contentStore = ContentStore.open(config.getDatabaseUrl());
        this.exactIndex = new ExactTokenIndex(indexRoot.resolve("exact"), config.getNrtRefreshIntervalMs());
        this.segmentedIndex = new SegmentedTokenIndex(indexRoot.resolve("segmented"),
                config.getNrtRefreshIntervalMs());
        final List<IndexBackend> backends = List.of(exactIndex, segmentedIndex);

        final QueryPlanner planner = new QueryPlanner(
                exactIndex,
                segmentedIndex,
                exactIndex,
                new FuzzyVariantGenerator(config.getFuzzyMinLength(), config.getFuzzyMaxLength(),
                        config.getCategoryExpansions()),
                new ScoreNormalizer(),
                config.getCandidateLimit());

        this.ingestionService = new IngestionService(contentStore, backends);
        this.searchService = new SearchService(contentStore, planner, config);
        this.tools = new MemoryIndexTools(searchService, ingestionService, contentStore, backends,
                indexRoot.toString());
    }

    /**
     * Creates missing tables, opens both indexes and rebuilds them if they are outdated or damaged.
     */
    public void init() throws IOException {
        logger.info("Initializing memory index...");

        contentStore.init();
        exactIndex.init();
        segmentedIndex.init();

        final Optional<RebuildResult> rebuild = ingestionService.rebuildIfRequired();
        rebuild.ifPresent(result -> logger.warn("Indexes were rebuilt from {} stored fields in {}ms",
                result.fieldsIndexed(), result.durationMs()));

        logger.info("All services initialized successfully");
    }

    /**
     * Starts the MCP server and blocks until the process is asked to stop.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation("MCP Memory Index", version());

        final StdioServerTransportProvider transportProvider =
                new StdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    private static String version() {
        final String version = MemoryIndexApplication.class.getPackage().getImplementationVersion();
        return version == null ? "development" : version;
    }

    /**
     * Closes everything in reverse order of creation. Each step runs even if an earlier one failed.
     */
    public void shutdown() {
        logger.info("Shutting down memory index...");

        if (mcpServer != null) {
            try {
                mcpServer.close();
            } catch (final RuntimeException e) {
                logger.error("Error closing MCP server", e);
            }
        }

        searchService.close();

        try {
            segmentedIndex.close();
        } catch (final IOException e) {
            logger.error("Error closing segmented index", e);
        }

        try {
            exactIndex.close();
        } catch (final IOException e) {
            logger.error("Error closing exact index", e);
        }

        contentStore.close();

        logger.info("Memory index shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging must be configured before anything logs
            final boolean deployedMode = LoggingConfigurator.isDeployedProfileActive();
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Index path: {}, database: {}", config.getIndexPath(), config.getDatabaseUrl());
            }

            final MemoryIndexApplication app = new MemoryIndexApplication(config);
            app.init();
            app.start();
        } catch (final Exception e) {
            // In deployed mode the console is the MCP channel, so only stderr is safe
            System.err.println("Failed to start memory index: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
