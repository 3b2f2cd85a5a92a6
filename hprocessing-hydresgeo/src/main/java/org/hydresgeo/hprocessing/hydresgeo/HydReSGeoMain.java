package org.hydresgeo.hprocessing.hydresgeo;

import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.hydresgeo.config.ProcessingConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: {@code HydReSGeoMain <config.json> <dataDirectory> [-v]}.
 */
public class HydReSGeoMain {

    private static final Logger LOGGER = Logger.getLogger(HProcessingConstants.LOGGER_NAME);

    static final String VERBOSE_OPTION = "-v";
    static final String USAGE = "Usage: HydReSGeoMain <config.json> <dataDirectory> [" + VERBOSE_OPTION + "]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2 || args.length > 3 || (args.length == 3 && !VERBOSE_OPTION.equals(args[2]))) {
            System.err.println(USAGE);
            return 2;
        }
        if (args.length == 3) {
            setVerbose();
        }
        try {
            final ProcessingConfig config = ProcessingConfig.read(Path.of(args[0]), Path.of(args[1]));
            final List<DatasetRow> rows = new HydReSGeoDatasetProcessor(config).process();
            LOGGER.fine("Successfully executed, " + rows.size() + " rows");
            return 0;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Processing failed: " + e.getMessage(), e);
            return 1;
        }
    }

    private static void setVerbose() {
        LOGGER.setLevel(Level.FINE);
        LOGGER.setUseParentHandlers(false);
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        LOGGER.addHandler(handler);
    }
}
