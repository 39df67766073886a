package rt.congestion.application.geometry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import rt.congestion.application.analytics.EdgeAggregator;
import rt.congestion.application.analytics.EdgeCongestionTable;
import rt.congestion.backend.network.NetworkProjection;
import rt.congestion.backend.network.RoadNetwork;
import rt.congestion.backend.network.RoadSegment;
import rt.congestion.config.PipelineConfig;

class SegmentGeometryBuilderTest {

    private final PipelineConfig config = new PipelineConfig();
    private final SegmentGeometryBuilder builder = SegmentGeometryBuilder.fromConfig(config);

    private static RoadSegment segment(String id, int lanes, double lengthM, boolean roundabout, double... xy) {
        List<Coordinate> shape = new ArrayList<>();
        for (int i = 0; i < xy.length; i += 2) {
            shape.add(new Coordinate(xy[i], xy[i + 1]));
        }
        return new RoadSegment(id, lanes, 10.0, lengthM, shape, roundabout);
    }

    private static RoadNetwork network(RoadSegment... segments) {
        return new RoadNetwork(Arrays.asList(segments), NetworkProjection.identity());
    }

    private EdgeCongestionTable table(RoadNetwork network, EdgeAggregator aggregator) {
        return EdgeCongestionTable.build(aggregator.getAggregates(), network, config);
    }

    private static void samples(EdgeAggregator aggregator, String laneId, double speedMs, int count) {
        for (int i = 0; i < count; i++) {
            aggregator.add(laneId, speedMs);
        }
    }

    @Test
    @DisplayName("Split segments 12#0 and 12#1 become one two-lane road in split order")
    void mergesSplitSegmentsIntoOneRoad() {
        // 12#1 steht in der Datei vor 12#0
        RoadNetwork net = network(
                segment("12#1", 2, 300.0, false, 28.81, 47.0, 28.82, 47.0),
                segment("12#0", 2, 100.0, false, 28.80, 47.0, 28.81, 47.0));
        EdgeAggregator agg = new EdgeAggregator();
        samples(agg, "12#0_0", 5.0, 4);   // 18 km/h von 36 -> 0.5
        samples(agg, "12#1_1", 10.0, 8);  // 36 km/h von 36 -> 1.0

        List<LogicalRoad> roads = builder.buildRoads(net, table(net, agg));

        assertEquals(1, roads.size());
        LogicalRoad road = roads.get(0);
        assertEquals(List.of("12#0", "12#1"), List.of(road.segments.get(0).id, road.segments.get(1).id));
        assertEquals(3, road.geometry.size());
        assertEquals(28.80, road.geometry.get(0).x, 0.0);
        assertEquals(28.82, road.geometry.get(2).x, 0.0);
        // (0.5 * 100 + 1.0 * 300) / 400
        assertEquals(0.875, road.speedRatio, 1e-9);
        // (1.0 * 100 + 2.0 * 300) / 400
        assertEquals(1.75, road.peakFlow, 1e-9);

        List<CongestionFeature> features = builder.build(net, table(net, agg));
        assertEquals(2, features.size());
        for (CongestionFeature f : features) {
            assertEquals(0.875, f.speedRatio, 0.0);
            assertEquals(1, f.peakFlow);
            assertEquals(2, f.laneCount);
            assertArrayEquals(new int[] { 136, 204, 0 }, f.color);
            assertEquals(3, f.geometry.getNumPoints());
        }
        assertEquals(-1.6, features.get(0).offsetMeters, 1e-12);
        assertEquals(1.6, features.get(1).offsetMeters, 1e-12);
        assertTrue(features.get(0).geometry.getCoordinateN(0).y < 47.0);
        assertTrue(features.get(1).geometry.getCoordinateN(0).y > 47.0);
    }

    @Test
    @DisplayName("Only the sampled part of a split road contributes to it")
    void unsampledSplitSegmentIsLeftOut() {
        RoadNetwork net = network(
                segment("12#0", 2, 100.0, false, 28.80, 47.0, 28.81, 47.0),
                segment("12#1", 2, 300.0, false, 28.81, 47.0, 28.82, 47.0));
        EdgeAggregator agg = new EdgeAggregator();
        samples(agg, "12#0_0", 5.0, 4);   // 18 km/h von 36 -> 0.5

        List<LogicalRoad> roads = builder.buildRoads(net, table(net, agg));

        assertEquals(1, roads.size());
        LogicalRoad road = roads.get(0);
        assertEquals(1, road.segments.size());
        assertEquals("12#0", road.segments.get(0).id);
        assertEquals(2, road.geometry.size());
        assertEquals(28.81, road.geometry.get(1).x, 0.0);
        assertEquals(0.5, road.speedRatio, 1e-9);
        assertEquals(1.0, road.peakFlow, 1e-9);

        List<CongestionFeature> features = builder.build(net, table(net, agg));
        assertEquals(2, features.size());
        for (CongestionFeature f : features) {
            assertEquals(0.5, f.speedRatio, 0.0);
            assertEquals(2, f.laneCount);
            assertEquals(2, f.geometry.getNumPoints());
        }

        assertTrue(builder.build(net, table(net, new EdgeAggregator())).isEmpty());
    }

    @Test
    void mergeDropsJoinPointWithinTolerance() {
        RoadSegment a = segment("5#0", 1, 10.0, false, 0.0, 0.0, 1.0, 0.0);
        RoadSegment b = segment("5#1", 1, 10.0, false, 1.00004, 0.00004, 2.0, 0.0);
        RoadSegment c = segment("5#2", 1, 10.0, false, 2.0001, 0.0, 3.0, 0.0);
        RoadNetwork net = network(a, b, c);

        List<Coordinate> ab = builder.merge(net, List.of(a, b));
        assertEquals(a.shape.size() + b.shape.size() - 1, ab.size());
        assertEquals(new Coordinate(1.0, 0.0), ab.get(1));

        // Lücke größer als die Toleranz -> beide Punkte bleiben
        List<Coordinate> bc = builder.merge(net, List.of(b, c));
        assertEquals(4, bc.size());
    }

    @Test
    void segmentsWithoutSamplesAndInternalEdgesProduceNothing() {
        RoadNetwork net = network(
                segment(":J1_0", 1, 5.0, false, 28.80, 47.0, 28.8001, 47.0),
                segment("77", 1, 50.0, false, 28.90, 47.0, 28.91, 47.0));
        EdgeAggregator agg = new EdgeAggregator();
        samples(agg, ":J1_0_0", 3.0, 10);

        assertTrue(builder.build(net, table(net, agg)).isEmpty());
        assertTrue(builder.build(net, table(net, new EdgeAggregator())).isEmpty());
    }

    @Test
    void singleLaneRoadIsOneUnshiftedLine() {
        RoadNetwork net = network(segment("30", 1, 50.0, true, 28.83, 47.01, 28.831, 47.011));
        EdgeAggregator agg = new EdgeAggregator();
        samples(agg, "30_0", 1.0, 3);

        List<CongestionFeature> features = builder.build(net, table(net, agg));

        assertEquals(1, features.size());
        CongestionFeature f = features.get(0);
        assertEquals(1, f.laneCount);
        assertEquals(0.0, f.offsetMeters, 0.0);
        assertTrue(f.roundabout);
        assertEquals(new Coordinate(28.83, 47.01), f.geometry.getCoordinateN(0));
        // 3.6 / 36 = 0.1
        assertArrayEquals(new int[] { 204, 0, 0 }, f.color);
    }

    @Test
    void directionsAndLaneCountsAreSeparateRoads() {
        RoadNetwork net = network(
                segment("12#0", 2, 100.0, false, 28.80, 47.0, 28.81, 47.0),
                segment("-12#0", 2, 100.0, false, 28.81, 47.0003, 28.80, 47.0003),
                segment("12#1", 3, 100.0, false, 28.81, 47.0, 28.82, 47.0));
        EdgeAggregator agg = new EdgeAggregator();
        samples(agg, "12#0_0", 5.0, 1);
        samples(agg, "-12#0_0", 5.0, 1);
        samples(agg, "12#1_0", 5.0, 1);

        List<LogicalRoad> roads = builder.buildRoads(net, table(net, agg));

        assertEquals(3, roads.size());
        assertEquals(RoadGroupKey.of("12#0", 2), roads.get(0).key);
        assertTrue(roads.get(1).key.reverse);
        assertEquals(3, roads.get(2).getLaneCount());
        assertEquals(2 + 2 + 3, builder.build(net, table(net, agg)).size());
    }

    @Test
    void groupWithDegenerateShapeIsDropped() {
        RoadNetwork net = network(segment("8", 1, 10.0, false, 28.8, 47.0));
        EdgeAggregator agg = new EdgeAggregator();
        samples(agg, "8_0", 5.0, 1);

        assertTrue(builder.buildRoads(net, table(net, agg)).isEmpty());
    }
}
