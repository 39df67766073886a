package rt.congestion.backend.trace;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rt.congestion.application.analytics.EdgeAggregator;
import rt.congestion.application.trajectory.TrajectoryAccumulator;
import rt.congestion.application.window.WindowFilter;
import rt.congestion.application.window.WindowMembership;

/**
 * TraceScanner
 *
 * - liest den FCD-Trace Zeile für Zeile (nie komplett im Speicher)
 * - "<timestep" -> neue Zeit, Fenster einmal pro Timestep prüfen
 * - "<vehicle"  -> nur wenn der Timestep in einem Fenster liegt, nur die nötigen Attribute lesen
 * - kaputte Zeile -> nur diese Zeile fällt weg
 * - nach dem Horizont des WindowFilters wird abgebrochen (Zeit ist monoton)
 *
 * Die Akkumulatoren gehören während des Scans nur diesem Loop.
 */
public class TraceScanner {

    private static final Logger LOG = LoggerFactory.getLogger(TraceScanner.class);

    private static final String TIMESTEP_TAG = "<timestep";
    private static final String VEHICLE_TAG = "<vehicle";
    private static final int READ_BUFFER_CHARS = 1 << 20;

    private final WindowFilter windows;
    private final TrajectoryAccumulator trajectories;
    private final EdgeAggregator edges;
    private final boolean earlyStop;
    private final int progressStepPercent;

    // Zustand pro Scan
    private double currentTime;
    private int currentSecond;
    private WindowMembership membership;
    private long skippedRecords;

    /**
     * @param windows             window definitions
     * @param trajectories        receives trajectory samples, null to skip trajectories
     * @param edges               receives aggregation samples, null to skip aggregation
     * @param earlyStop           stop once the window horizon is passed
     * @param progressStepPercent log progress every n percent of the file
     */
    public TraceScanner(WindowFilter windows, TrajectoryAccumulator trajectories, EdgeAggregator edges,
            boolean earlyStop, int progressStepPercent) {
        this.windows = windows;
        this.trajectories = trajectories;
        this.edges = edges;
        this.earlyStop = earlyStop;
        this.progressStepPercent = Math.max(1, progressStepPercent);
    }

    /**
     * Runs the single pass over the trace.
     *
     * @param trace FCD trace file
     * @return counters of the pass
     * @throws IOException if reading fails midway
     * @throws IllegalStateException if the file is missing or unreadable
     */
    public ScanSummary scan(Path trace) throws IOException {
        if (!Files.isRegularFile(trace) || !Files.isReadable(trace)) {
            throw new IllegalStateException("FCD trace not found or unreadable: " + trace);
        }

        long totalBytes = Math.max(1L, Files.size(trace));
        long start = System.nanoTime();

        currentTime = Double.NaN;
        currentSecond = 0;
        membership = WindowMembership.NONE;
        skippedRecords = 0;

        long lines = 0;
        long timesteps = 0;
        long vehicleLines = 0;
        long charsRead = 0;
        int lastReportedPercent = -progressStepPercent;
        boolean stoppedEarly = false;

        LOG.info("[SCAN] {} ({} MB), horizon t={}", trace, totalBytes / 1_000_000, windows.horizon());

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(trace), StandardCharsets.UTF_8), READ_BUFFER_CHARS)) {

            String line;
            while ((line = reader.readLine()) != null) {
                lines++;
                // Zeichen statt Bytes, reicht für die Fortschrittsanzeige
                charsRead += line.length() + 1;

                if (line.contains(TIMESTEP_TAG)) {
                    timesteps++;
                    if (!advanceTime(line)) {
                        continue;
                    }
                    if (earlyStop && windows.isPastHorizon(currentTime)) {
                        stoppedEarly = true;
                        break;
                    }

                    int percent = (int) Math.min(100, charsRead * 100 / totalBytes);
                    if (percent >= lastReportedPercent + progressStepPercent) {
                        lastReportedPercent = percent;
                        reportProgress(percent, start);
                    }

                } else if (membership.any() && line.contains(VEHICLE_TAG)) {
                    vehicleLines++;
                    foldSample(line);
                }
            }
        }

        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        ScanSummary summary = new ScanSummary(lines, timesteps, vehicleLines, skippedRecords,
                currentTime, stoppedEarly, elapsedMillis);
        LOG.info("[SCAN] done: {}", summary);
        return summary;
    }

    // Zeit-Cursor weiterschieben. Kaputte Zeit -> Timestep ungültig, Samples bis zum
    // nächsten gültigen Timestep werden übersprungen (keine Zeit zuordenbar).
    private boolean advanceTime(String line) {
        OptionalDouble time = FieldDecoder.number(line, "time");
        if (time.isEmpty()) {
            skippedRecords++;
            membership = WindowMembership.NONE;
            return false;
        }
        currentTime = time.getAsDouble();
        currentSecond = (int) Math.floor(currentTime);
        membership = windows.evaluate(currentTime);
        return true;
    }

    private void foldSample(String line) {
        if (membership.trajectory() && trajectories != null) {
            Optional<String> id = FieldDecoder.text(line, "id");
            OptionalDouble x = FieldDecoder.number(line, "x");
            OptionalDouble y = FieldDecoder.number(line, "y");
            OptionalDouble speed = FieldDecoder.number(line, "speed");

            if (id.isPresent() && x.isPresent() && y.isPresent() && speed.isPresent()) {
                trajectories.add(id.get(), currentSecond, x.getAsDouble(), y.getAsDouble(), speed.getAsDouble());
            } else {
                skippedRecords++;
            }
        }

        if (membership.aggregation() && edges != null) {
            Optional<String> lane = FieldDecoder.text(line, "lane");
            OptionalDouble speed = FieldDecoder.number(line, "speed");

            if (lane.isPresent() && speed.isPresent()) {
                edges.add(lane.get(), speed.getAsDouble());
            } else {
                skippedRecords++;
            }
        }
    }

    private void reportProgress(int percent, long startNanos) {
        long elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000L;
        int vehicles = trajectories == null ? 0 : trajectories.trackedVehicles();
        int segments = edges == null ? 0 : edges.distinctSegments();

        LOG.info(progressLine(currentTime, percent, vehicles, segments, elapsedSeconds));
    }

    static String progressLine(double time, int percent, int vehicles, int segments, long elapsedSeconds) {
        return String.format(Locale.ROOT, "[SCAN] %.2fh sim | %d%% file | %d vehicles | %d edges | %ds",
                time / 3600.0, percent, vehicles, segments, elapsedSeconds);
    }
}
