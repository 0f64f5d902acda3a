package de.mirkosertic.homelibrary;

import de.mirkosertic.homelibrary.config.ApplicationConfig;
import de.mirkosertic.homelibrary.config.LoggingConfigurator;
import de.mirkosertic.homelibrary.index.BookDocumentMapper;
import de.mirkosertic.homelibrary.index.CatalogIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Main entry point for the Home Library.
 * Initializes the catalog index and runs the interactive shell on stdin/stdout.
 */
public class HomeLibraryApplication {

    private static final Logger logger = LoggerFactory.getLogger(HomeLibraryApplication.class);

    private final NormalizationContext normalizationContext;
    private final CatalogIndexService indexService;
    private final CatalogSession session;

    public HomeLibraryApplication(final ApplicationConfig config) {
        // Index population and query building must share one folding context
        this.normalizationContext = NormalizationContext.create(config);

        final BookDocumentMapper documentMapper =
                new BookDocumentMapper(normalizationContext.getIndexedContentBuilder());

        this.indexService = new CatalogIndexService(config, documentMapper);
        this.session = new CatalogSession(indexService, normalizationContext);
    }

    /**
     * Open the catalog index.
     */
    public void init() throws IOException {
        logger.info("Initializing Home Library...");
        indexService.init();
        if (indexService.isContentRebuilt()) {
            logger.info("Search content was rebuilt for the current folding rules");
        }
        logger.info("Home Library initialized");
    }

    /**
     * Run the shell until the user quits or the input ends.
     */
    public void run(final Reader in, final Writer out) throws IOException {
        final CatalogShell shell = new CatalogShell(session, normalizationContext.getFoldingTable().getStats(), in, out);
        shell.run();
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down Home Library...");
        logger.debug("Folding cache: {}", normalizationContext.getFoldingTable().getStats());

        try {
            indexService.close();
        } catch (final Exception e) {
            logger.error("Error closing index service", e);
        }

        logger.info("Home Library shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, so that nothing logs to the shell's stdout
            final boolean interactiveMode = ApplicationConfig.isInteractiveProfile();
            LoggingConfigurator.configure(interactiveMode);

            final ApplicationConfig config = ApplicationConfig.load();
            if (!interactiveMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Index path: {}", config.getIndexPath());
            }

            final HomeLibraryApplication app = new HomeLibraryApplication(config);
            app.init();
            try {
                app.run(new InputStreamReader(System.in, StandardCharsets.UTF_8),
                        new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            } finally {
                app.shutdown();
            }

        } catch (final Exception e) {
            // In interactive mode the log goes to a file, so report on stderr as well
            System.err.println("Failed to run Home Library: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
