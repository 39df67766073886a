package rt.congestion.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/*
 * PipelineConfig
 *
 * Alle Konstanten der Nachbearbeitung an einer Stelle:
 * - Pfade (Netz, FCD-Trace, Output)
 * - Zeitfenster (Trajektorien + Peak-Aggregation)
 * - Grenzwerte (MIN_WAYPOINTS, MAX_VEHICLES, Stau-Schwellen, Farben)
 * - Geometrie (Spurbreite, Grad pro Meter, Merge-Toleranz)
 * - Referenz-Korridore für die Validierung
 *
 * Defaults liegen als pipeline.json im Classpath, eine eigene Datei ersetzt sie komplett.
 * Felder sind public wie in den Analytics-Datenklassen, Jackson füllt sie direkt.
 */
public class PipelineConfig {

    public static final String DEFAULT_RESOURCE = "/pipeline.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    // ==================================================
    // PATHS
    // ==================================================
    public String netPath = "data/sumo_net/network.net.xml";
    public String tracePath = "data/outputs/fcd_full.xml";
    public String outputDir = "data/outputs";

    // x/y im Trace sind schon lon/lat (fcd-output.geo) -> keine Projektion nötig
    public boolean traceGeoCoordinates = true;

    // ==================================================
    // SCAN
    // ==================================================
    public boolean earlyStop = true;
    public int progressStepPercent = 1;

    public WindowSpec trajectoryWindow = new WindowSpec("morning", 7 * 3600, 9 * 3600, 60, 1);
    public List<WindowSpec> aggregationWindows = new ArrayList<>(List.of(
            new WindowSpec("morning", 7 * 3600, 9 * 3600, 0, 30),
            new WindowSpec("evening", 17 * 3600, 20 * 3600, 0, 30)));

    // ==================================================
    // TRAJECTORIES
    // ==================================================
    public int minWaypoints = 5;
    public int maxVehicles = 8000;
    public int coordinateDecimals = 5;

    // ==================================================
    // CONGESTION
    // ==================================================
    public double[] congestionThresholds = { 0.25, 0.45, 0.60, 0.75, 0.90 };
    public int[][] congestionColors = {
            { 204, 0, 0 },
            { 255, 68, 0 },
            { 255, 136, 0 },
            { 255, 187, 0 },
            { 136, 204, 0 },
            { 0, 170, 68 } };

    public double minFreeflowKmh = 10.0;
    public double defaultFreeflowKmh = 50.0;
    public double defaultLengthM = 50.0;
    public double peakFlowDivisor = 4.0;

    // ==================================================
    // GEOMETRY
    // ==================================================
    public double laneWidth = 3.2;
    public double lonDegreesPerMeter = 1.0 / 75000.0;
    public double latDegreesPerMeter = 1.0 / 111000.0;
    public double mergeTolerance = 5e-5;

    // ==================================================
    // VALIDATION
    // ==================================================
    public List<CorridorSpec> corridors = new ArrayList<>();

    // ==================================================
    // LOADING
    // ==================================================

    /**
     * Loads the bundled defaults from the classpath.
     */
    public static PipelineConfig loadDefaults() {
        try (InputStream in = PipelineConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Default config not found on classpath: " + DEFAULT_RESOURCE);
            }
            PipelineConfig config = MAPPER.readValue(in, PipelineConfig.class);
            config.validate();
            return config;
        } catch (IOException ex) {
            throw new IllegalStateException("Default config unreadable: " + DEFAULT_RESOURCE, ex);
        }
    }

    /**
     * Loads a config file that replaces the bundled defaults. Fields missing in
     * the file keep their built-in values.
     */
    public static PipelineConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Config file not found: " + file);
        }
        try {
            PipelineConfig config = MAPPER.readValue(file.toFile(), PipelineConfig.class);
            config.validate();
            return config;
        } catch (IOException ex) {
            throw new IllegalStateException("Config file unreadable: " + file, ex);
        }
    }

    /**
     * Checks the invariants the pipeline relies on.
     *
     * @throws IllegalArgumentException on the first violated rule
     */
    public void validate() {
        if (trajectoryWindow == null) {
            throw new IllegalArgumentException("trajectoryWindow missing");
        }
        if (aggregationWindows == null || aggregationWindows.isEmpty()) {
            throw new IllegalArgumentException("at least one aggregation window required");
        }
        if (minWaypoints < 1) {
            throw new IllegalArgumentException("minWaypoints must be >= 1, was " + minWaypoints);
        }
        if (maxVehicles < 1) {
            throw new IllegalArgumentException("maxVehicles must be >= 1, was " + maxVehicles);
        }
        if (coordinateDecimals < 0 || coordinateDecimals > 10) {
            throw new IllegalArgumentException("coordinateDecimals out of range: " + coordinateDecimals);
        }
        if (congestionThresholds == null || congestionThresholds.length != 5) {
            throw new IllegalArgumentException("exactly 5 congestion thresholds required");
        }
        for (int i = 1; i < congestionThresholds.length; i++) {
            if (congestionThresholds[i] <= congestionThresholds[i - 1]) {
                throw new IllegalArgumentException("congestion thresholds must be strictly ascending");
            }
        }
        if (congestionColors == null || congestionColors.length != congestionThresholds.length + 1) {
            throw new IllegalArgumentException("exactly " + (congestionThresholds.length + 1) + " congestion colors required");
        }
        for (int[] rgb : congestionColors) {
            if (rgb == null || rgb.length != 3) {
                throw new IllegalArgumentException("congestion colors must be [r,g,b] triples");
            }
        }
        if (peakFlowDivisor <= 0) {
            throw new IllegalArgumentException("peakFlowDivisor must be positive");
        }
        if (laneWidth < 0 || mergeTolerance < 0) {
            throw new IllegalArgumentException("laneWidth and mergeTolerance must not be negative");
        }
        if (progressStepPercent < 1) {
            progressStepPercent = 1;
        }
        if (corridors == null) {
            corridors = new ArrayList<>();
        }
    }
}
