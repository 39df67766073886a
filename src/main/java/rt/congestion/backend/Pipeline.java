package rt.congestion.backend;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rt.congestion.application.analytics.EdgeAggregator;
import rt.congestion.application.analytics.EdgeCongestionTable;
import rt.congestion.application.geometry.CongestionFeature;
import rt.congestion.application.geometry.SegmentGeometryBuilder;
import rt.congestion.application.trajectory.PositionConverter;
import rt.congestion.application.trajectory.Trajectory;
import rt.congestion.application.trajectory.TrajectoryAccumulator;
import rt.congestion.application.validation.ValidationReport;
import rt.congestion.application.validation.Validator;
import rt.congestion.application.window.WindowFilter;
import rt.congestion.backend.network.NetworkLoader;
import rt.congestion.backend.network.RoadNetwork;
import rt.congestion.backend.trace.ScanSummary;
import rt.congestion.backend.trace.TraceScanner;
import rt.congestion.config.PipelineConfig;
import rt.congestion.config.PipelinePaths;
import rt.congestion.export.GeoJsonWriter;
import rt.congestion.export.TrajectoryWriter;

/**
 * Pipeline
 *
 * - EIN Durchlauf über den Trace, alle Fenster gleichzeitig
 * - danach: Trajektorien finalisieren, Kanten-Tabelle, Stau-Karte, Validierung
 * - einzige Stelle, die Dateien schreibt
 */
public class Pipeline {

    private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

    private final PipelineConfig config;
    private final PipelinePaths paths;
    private final PrintStream console;

    public Pipeline(PipelineConfig config, PipelinePaths paths) {
        this(config, paths, System.out);
    }

    /**
     * @param console receives the banner and the validation table
     */
    public Pipeline(PipelineConfig config, PipelinePaths paths, PrintStream console) {
        this.config = config;
        this.paths = paths;
        this.console = console;
    }

    /*
     * ==========================================================
     * RUN
     * ==========================================================
     */
    public PipelineResult run(RunMode mode) throws IOException {
        printStartupBanner(mode);

        WindowFilter windows = new WindowFilter(
                mode.trajectories() ? config.trajectoryWindow : null,
                mode.congestion() ? config.aggregationWindows : List.of());

        // Netz nur laden, wenn es gebraucht wird
        RoadNetwork network = null;
        if (mode.congestion() || !config.traceGeoCoordinates) {
            network = NetworkLoader.load(paths.getNetPath());
        }

        TrajectoryAccumulator trajectories = null;
        if (mode.trajectories()) {
            PositionConverter converter = config.traceGeoCoordinates ? PositionConverter.GEO : network.getProjection();
            trajectories = new TrajectoryAccumulator(converter, config.coordinateDecimals);
        }
        EdgeAggregator edges = mode.congestion() ? new EdgeAggregator() : null;

        TraceScanner scanner = new TraceScanner(windows, trajectories, edges, config.earlyStop,
                config.progressStepPercent);
        ScanSummary scan = scanner.scan(paths.getTracePath());

        List<Trajectory> finished = List.of();
        if (trajectories != null) {
            finished = finishTrajectories(trajectories);
        }

        EdgeCongestionTable table = null;
        List<CongestionFeature> features = List.of();
        ValidationReport report = null;
        if (edges != null) {
            table = EdgeCongestionTable.build(edges.getAggregates(), network, config);
            table.logSummary();
            table.exportToCsv(paths.exportFile(PipelinePaths.EDGE_TABLE_FILE));

            features = buildCongestionMap(network, table);
            report = validate(network, table);
        }

        LOG.info("[RUN] {} finished: {} trajectories, {} edges, {} features, scan {}", mode, finished.size(),
                table == null ? 0 : table.size(), features.size(), scan);

        return new PipelineResult(mode, scan, finished, table, features, report);
    }

    private List<Trajectory> finishTrajectories(TrajectoryAccumulator trajectories) throws IOException {
        List<Trajectory> finished = trajectories.finish(config.minWaypoints, config.maxVehicles);
        LOG.info("[TRIPS] {} vehicles seen, {} kept (min {} waypoints, max {}), {} waypoints dropped",
                trajectories.trackedVehicles(), finished.size(), config.minWaypoints, config.maxVehicles,
                trajectories.getDroppedWaypoints());

        new TrajectoryWriter().write(finished, paths.exportFile(PipelinePaths.TRAJECTORIES_FILE));
        LOG.info("[TRIPS] exportiert nach: {}", paths.exportFile(PipelinePaths.TRAJECTORIES_FILE));
        return finished;
    }

    private List<CongestionFeature> buildCongestionMap(RoadNetwork network, EdgeCongestionTable table)
            throws IOException {
        List<CongestionFeature> features = SegmentGeometryBuilder.fromConfig(config).build(network, table);
        new GeoJsonWriter().write(features, paths.exportFile(PipelinePaths.CONGESTION_FILE));
        LOG.info("[MAP] {} features exportiert nach: {}", features.size(),
                paths.exportFile(PipelinePaths.CONGESTION_FILE));
        return features;
    }

    private ValidationReport validate(RoadNetwork network, EdgeCongestionTable table) throws IOException {
        ValidationReport report = new Validator(config.corridors).validate(network, table);
        report.printTable(console);
        report.exportToCsv(paths.exportFile(PipelinePaths.VALIDATION_CSV_FILE));
        report.exportToPdf(paths.exportFile(PipelinePaths.VALIDATION_PDF_FILE));
        return report;
    }

    private void printStartupBanner(RunMode mode) {
        console.println();
        console.println("========================================");
        console.println("      FCD CONGESTION POST-PROCESSING");
        console.println("========================================");
        console.println("[NET]   " + paths.getNetPath());
        console.println("[TRACE] " + paths.getTracePath());
        console.println("[OUT]   " + paths.getExportPath());
        console.println("[MODE]  " + mode.name().toLowerCase(Locale.ROOT));
        console.println("========================================\n");
    }
}
