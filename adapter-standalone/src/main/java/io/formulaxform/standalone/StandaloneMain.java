package io.formulaxform.standalone;

import io.formulaxform.standalone.generate.GeneratorApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the standalone generator. Delegates to {@link GeneratorApp#run(String[])} and
 * exits with its status code.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/formula-xform.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = GeneratorApp.run(args);
        } catch (Exception e) {
            LOG.error("Generation failed: {}", e.getMessage(), e);
            status = GeneratorApp.EXIT_FAILURE;
        }
        System.exit(status);
    }
}
