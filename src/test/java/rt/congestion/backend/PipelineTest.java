package rt.congestion.backend;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import rt.congestion.application.geometry.CongestionFeature;
import rt.congestion.application.validation.Verdict;
import rt.congestion.backend.trace.FcdTraceBuilder;
import rt.congestion.config.CorridorSpec;
import rt.congestion.config.PipelineConfig;
import rt.congestion.config.PipelinePaths;
import rt.congestion.config.WindowSpec;

/**
 * End to end over the small fixture network and a generated trace.
 */
class PipelineTest {

    @TempDir
    Path dir;

    private PipelineConfig config;
    private PipelinePaths paths;
    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException, URISyntaxException {
        FcdTraceBuilder trace = new FcdTraceBuilder();
        for (int t = 0; t <= 40; t++) {
            trace.timestep(t);
            trace.vehicle("v1", 28.80 + t * 0.0005, 47.0, 5.0, "12#0_0");
            trace.vehicle("v2", 28.81 + t * 0.0005, 47.0001, 10.0, "12#1_1");
            if (t <= 2) {
                trace.vehicle("v3", 28.81 - t * 0.0005, 47.0003, 2.0, "-12#0_0");
            }
            trace.vehicle("v4", 28.83, 47.01, 4.0, "30_0");
        }
        trace.writeTo(dir.resolve("fcd.xml"));

        config = new PipelineConfig();
        config.netPath = Paths.get(getClass().getResource("/net/small.net.xml").toURI()).toString();
        config.tracePath = dir.resolve("fcd.xml").toString();
        config.outputDir = dir.resolve("out").toString();
        config.progressStepPercent = 50;
        config.trajectoryWindow = new WindowSpec("trips", 0, 20, 0, 1);
        config.aggregationWindows = List.of(new WindowSpec("peak", 0, 20, 0, 10));
        config.corridors = List.of(
                new CorridorSpec("Strada 12", 28.79, 28.825, 46.99, 47.005, 20.0),
                new CorridorSpec("Far away", 10.0, 11.0, 10.0, 11.0, 20.0));
        config.validate();

        paths = new PipelinePaths(dir, config);
    }

    private PipelineResult run(RunMode mode) throws IOException {
        return new Pipeline(config, paths, new PrintStream(console, true, StandardCharsets.UTF_8)).run(mode);
    }

    @Test
    @DisplayName("Full run writes all outputs from one early-stopped scan")
    void fullRun() throws IOException {
        PipelineResult result = run(RunMode.FULL);

        assertTrue(result.scan.stoppedEarly);
        assertEquals(21.0, result.scan.lastTime, 0.0);

        // v3 hat nur 3 Waypoints
        assertEquals(3, result.trajectories.size());
        assertEquals("v1", result.trajectories.get(0).vehicleId);
        assertEquals(21, result.trajectories.get(0).size());

        assertEquals(4, result.edgeTable.size());
        assertEquals(3, result.edgeTable.get("12#0").sampleCount);
        assertEquals(18.0, result.edgeTable.get("12#0").meanSpeedKmh, 1e-9);
        assertFalse(result.edgeTable.contains("E7"));

        // 12 (2 Spuren) + -12 + 30
        assertEquals(4, result.features.size());
        CongestionFeature roundabout = result.features.get(3);
        assertTrue(roundabout.roundabout);
        assertArrayEquals(new int[] { 255, 136, 0 }, result.features.get(0).color);
        assertArrayEquals(new int[] { 204, 0, 0 }, result.features.get(2).color);

        assertEquals(Verdict.GOOD, result.validation.get("Strada 12").verdict);
        assertEquals(3, result.validation.get("Strada 12").matchedEdges);
        assertEquals(Verdict.NO_DATA, result.validation.get("Far away").verdict);

        Path out = dir.resolve("out");
        ObjectMapper mapper = new ObjectMapper();
        JsonNode trips = mapper.readTree(out.resolve(PipelinePaths.TRAJECTORIES_FILE).toFile());
        assertEquals(3, trips.size());
        JsonNode first = trips.get(0).get("waypoints").get(0);
        assertEquals(0, first.get(0).asInt());
        assertEquals(28.8, first.get(1).asDouble(), 0.0);
        assertEquals(18.0, first.get(3).asDouble(), 0.0);

        JsonNode map = mapper.readTree(out.resolve(PipelinePaths.CONGESTION_FILE).toFile());
        assertEquals(4, map.get("features").size());

        assertEquals(5, Files.readAllLines(out.resolve(PipelinePaths.EDGE_TABLE_FILE)).size());
        assertTrue(Files.exists(out.resolve(PipelinePaths.VALIDATION_CSV_FILE)));
        assertTrue(Files.size(out.resolve(PipelinePaths.VALIDATION_PDF_FILE)) > 0);

        String printed = console.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("[MODE]  full"));
        assertTrue(printed.contains("Strada 12"));
    }

    @Test
    void trajectoriesOnlyDoesNotNeedTheNetwork() throws IOException {
        config.netPath = dir.resolve("missing.net.xml").toString();

        PipelineResult result = run(RunMode.TRAJECTORIES);

        assertEquals(3, result.trajectories.size());
        assertNull(result.edgeTable);
        assertNull(result.validation);
        assertTrue(result.features.isEmpty());
        assertTrue(Files.exists(dir.resolve("out").resolve(PipelinePaths.TRAJECTORIES_FILE)));
        assertFalse(Files.exists(dir.resolve("out").resolve(PipelinePaths.CONGESTION_FILE)));
    }

    @Test
    void congestionOnlySkipsTrajectories() throws IOException {
        PipelineResult result = run(RunMode.CONGESTION);

        assertTrue(result.trajectories.isEmpty());
        assertEquals(4, result.features.size());
        assertFalse(Files.exists(dir.resolve("out").resolve(PipelinePaths.TRAJECTORIES_FILE)));
    }

    @Test
    void earlyStopDoesNotChangeOutputs() throws IOException {
        run(RunMode.FULL);
        Path out = dir.resolve("out");
        byte[] trips = Files.readAllBytes(out.resolve(PipelinePaths.TRAJECTORIES_FILE));
        byte[] map = Files.readAllBytes(out.resolve(PipelinePaths.CONGESTION_FILE));

        config.earlyStop = false;
        PipelineResult full = run(RunMode.FULL);

        assertFalse(full.scan.stoppedEarly);
        assertArrayEquals(trips, Files.readAllBytes(out.resolve(PipelinePaths.TRAJECTORIES_FILE)));
        assertArrayEquals(map, Files.readAllBytes(out.resolve(PipelinePaths.CONGESTION_FILE)));
    }

    @Test
    void missingTraceFails() {
        config.tracePath = dir.resolve("nothing.xml").toString();

        assertThrows(IllegalStateException.class, () -> run(RunMode.FULL));
    }
}
