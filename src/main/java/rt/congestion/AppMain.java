package rt.congestion;

import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rt.congestion.backend.Pipeline;
import rt.congestion.backend.RunMode;
import rt.congestion.config.PipelineConfig;
import rt.congestion.config.PipelinePaths;

public class AppMain {

    private static final Logger LOG = LoggerFactory.getLogger(AppMain.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /*
     * Aufruf: [mode] [config.json]
     *   mode   = full | trajectories | congestion (Default full)
     *   config = ersetzt die pipeline.json aus dem Classpath
     */
    static int run(String[] args) {
        RunMode mode = RunMode.FULL;
        String configFile = null;

        try {
            for (String arg : args) {
                if (arg.equals("-h") || arg.equals("--help")) {
                    printUsage();
                    return 0;
                }
                if (arg.endsWith(".json")) {
                    configFile = arg;
                } else {
                    mode = RunMode.parse(arg);
                }
            }

            /*
             * 1) Config laden
             */
            PipelineConfig config = configFile == null
                    ? PipelineConfig.loadDefaults()
                    : PipelineConfig.load(Paths.get(configFile));

            /*
             * 2) Pfade auflösen
             */
            PipelinePaths paths = new PipelinePaths(config);

            /*
             * 3) Ein Durchlauf
             */
            new Pipeline(config, paths).run(mode);
            return 0;

        } catch (IllegalArgumentException e) {
            LOG.error("[MAIN] Ungültige Eingabe: {}", e.getMessage());
            printUsage();
            return 1;
        } catch (Exception e) {
            LOG.error("[MAIN] Fehler: {}", e.getMessage(), e);
            return 1;
        }
    }

    private static void printUsage() {
        System.out.println("Usage: fcd-congestion-map [full|trajectories|congestion] [config.json]");
    }
}
