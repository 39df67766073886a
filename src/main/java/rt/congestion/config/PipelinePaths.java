package rt.congestion.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/*
 * PipelinePaths
 *
 * Löst die Pfade aus der Config auf (relativ -> gegen das Projekt-Root)
 * und kennt die Namen aller Output-Dateien.
 */
public final class PipelinePaths {

    public static final String TRAJECTORIES_FILE = "trips_deckgl.json";
    public static final String CONGESTION_FILE = "roads_congestion.geojson";
    public static final String EDGE_TABLE_FILE = "edge_congestion.csv";
    public static final String VALIDATION_CSV_FILE = "validation_report.csv";
    public static final String VALIDATION_PDF_FILE = "validation_report.pdf";

    private final Path projectRoot;
    private final PipelineConfig config;

    public PipelinePaths(PipelineConfig config) {
        this(Paths.get(System.getProperty("user.dir")), config);
    }

    public PipelinePaths(Path projectRoot, PipelineConfig config) {
        this.projectRoot = projectRoot;
        this.config = config;
    }

    // ==================================================
    // INPUT
    // ==================================================
    public Path getNetPath() {
        return resolve(config.netPath);
    }

    public Path getTracePath() {
        return resolve(config.tracePath);
    }

    // ==================================================
    // EXPORT PATH
    // ==================================================
    public Path getExportPath() {
        Path dir = resolve(config.outputDir);
        try {
            Files.createDirectories(dir);
        } catch (IOException ex) {
            throw new UncheckedIOException("Export directory not creatable: " + dir, ex);
        }
        return dir;
    }

    public Path exportFile(String fileName) {
        return getExportPath().resolve(fileName);
    }

    private Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalStateException("Path not configured");
        }
        Path p = Paths.get(path);
        return p.isAbsolute() ? p : projectRoot.resolve(p).normalize();
    }
}
