package rt.congestion.application.geometry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rt.congestion.application.analytics.EdgeCongestion;
import rt.congestion.application.analytics.EdgeCongestionTable;
import rt.congestion.application.congestion.CongestionClassifier;
import rt.congestion.backend.network.RoadNetwork;
import rt.congestion.backend.network.RoadSegment;
import rt.congestion.config.PipelineConfig;

/**
 * SegmentGeometryBuilder
 *
 * Aus vielen kleinen Segmenten werden durchgehende, mehrspurige Straßen:
 *
 * 1) Filter     : interne Kanten und Kanten ohne Samples raus
 * 2) Gruppieren : (baseId, laneCount, Richtung)
 * 3) Ordnen     : nach splitIndex ("#n"), fehlt er -> 0
 * 4) Mergen     : Shapes nach lon/lat, aneinanderhängen; fällt der erste Punkt eines
 *                 Segments mit dem letzten des vorigen zusammen (Toleranz), fliegt er raus
 * 5) Stau       : Speed-Ratio und Fluss längengewichtet über die Segmente
 * 6) Zeichnen   : n Spuren -> n parallel versetzte Linien, 1 Spur -> 1 Linie ohne Versatz
 *
 * Gruppen erscheinen in der Reihenfolge ihres ersten Segments in der net.xml.
 */
public class SegmentGeometryBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentGeometryBuilder.class);

    private final CongestionClassifier classifier;
    private final LaneOffsetter offsetter;
    private final double laneWidth;
    private final double mergeTolerance;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    public SegmentGeometryBuilder(CongestionClassifier classifier, double laneWidth, double lonDegreesPerMeter,
            double latDegreesPerMeter, double mergeTolerance) {
        this.classifier = classifier;
        this.offsetter = new LaneOffsetter(lonDegreesPerMeter, latDegreesPerMeter);
        this.laneWidth = laneWidth;
        this.mergeTolerance = mergeTolerance;
    }

    public static SegmentGeometryBuilder fromConfig(PipelineConfig config) {
        return new SegmentGeometryBuilder(
                new CongestionClassifier(config.congestionThresholds, config.congestionColors),
                config.laneWidth,
                config.lonDegreesPerMeter,
                config.latDegreesPerMeter,
                config.mergeTolerance);
    }

    /**
     * Builds the line features of the congestion map.
     *
     * @param network static network
     * @param table   aggregated edges
     * @return one feature per lane of every logical road, may be empty
     */
    public List<CongestionFeature> build(RoadNetwork network, EdgeCongestionTable table) {
        List<CongestionFeature> features = new ArrayList<>();
        for (LogicalRoad road : buildRoads(network, table)) {
            render(road, features);
        }
        LOG.info("[MAP] {} features", features.size());
        return features;
    }

    /**
     * Steps 1 to 5: grouped, ordered and merged roads with their severity.
     */
    public List<LogicalRoad> buildRoads(RoadNetwork network, EdgeCongestionTable table) {

        // 1) + 2) Filter und Gruppierung
        Map<RoadGroupKey, List<RoadSegment>> groups = new LinkedHashMap<>();
        for (RoadSegment segment : network.getSegments()) {
            if (RoadKeys.isInternal(segment.id) || !table.contains(segment.id)) {
                continue;
            }
            groups.computeIfAbsent(RoadGroupKey.of(segment.id, segment.laneCount), k -> new ArrayList<>())
                    .add(segment);
        }

        List<LogicalRoad> roads = new ArrayList<>(groups.size());
        int tooShort = 0;

        for (Map.Entry<RoadGroupKey, List<RoadSegment>> entry : groups.entrySet()) {
            List<RoadSegment> segments = new ArrayList<>(entry.getValue());

            // 3) Fahrtreihenfolge (stabile Sortierung)
            segments.sort(Comparator.comparingInt(s -> RoadKeys.splitIndex(s.id)));

            // 4) Geometrie
            List<Coordinate> merged = merge(network, segments);
            if (merged.size() < 2) {
                tooShort++;
                continue;
            }

            // 5) Stau-Werte
            LogicalRoad road = weigh(entry.getKey(), segments, merged, table);
            if (road != null) {
                roads.add(road);
            }
        }

        if (tooShort > 0) {
            LOG.debug("[MAP] {} groups dropped, merged shape shorter than 2 points", tooShort);
        }
        return roads;
    }

    List<Coordinate> merge(RoadNetwork network, List<RoadSegment> ordered) {
        List<Coordinate> merged = new ArrayList<>();
        for (RoadSegment segment : ordered) {
            List<Coordinate> lonLat = network.toLonLat(segment);
            if (lonLat.isEmpty()) {
                continue;
            }
            int from = 0;
            if (!merged.isEmpty() && coincides(merged.get(merged.size() - 1), lonLat.get(0))) {
                from = 1;
            }
            merged.addAll(lonLat.subList(from, lonLat.size()));
        }
        return merged;
    }

    private boolean coincides(Coordinate a, Coordinate b) {
        return Math.abs(a.x - b.x) < mergeTolerance && Math.abs(a.y - b.y) < mergeTolerance;
    }

    private LogicalRoad weigh(RoadGroupKey key, List<RoadSegment> segments, List<Coordinate> merged,
            EdgeCongestionTable table) {
        double weightSum = 0.0;
        double ratioSum = 0.0;
        double flowSum = 0.0;
        double plainRatioSum = 0.0;
        double plainFlowSum = 0.0;
        int rows = 0;
        boolean roundabout = false;

        for (RoadSegment segment : segments) {
            roundabout |= segment.roundabout;

            EdgeCongestion row = table.get(segment.id);
            if (row == null) {
                continue;
            }
            double w = row.lengthMeters;
            weightSum += w;
            ratioSum += row.speedRatio * w;
            flowSum += row.peakFlow * w;
            plainRatioSum += row.speedRatio;
            plainFlowSum += row.peakFlow;
            rows++;
        }

        if (rows == 0) {
            return null;
        }

        // alle Längen 0 -> ungewichtet
        double ratio = weightSum > 0.0 ? ratioSum / weightSum : plainRatioSum / rows;
        double flow = weightSum > 0.0 ? flowSum / weightSum : plainFlowSum / rows;

        return new LogicalRoad(key, segments, merged, ratio, flow, roundabout);
    }

    // 6) eine Linie pro Spur
    private void render(LogicalRoad road, List<CongestionFeature> out) {
        double ratio = Math.round(road.speedRatio * 1000.0) / 1000.0;
        int flow = (int) road.peakFlow;
        int[] color = classifier.colorFor(road.speedRatio);
        int lanes = road.getLaneCount();

        if (lanes <= 1) {
            out.add(new CongestionFeature(lineString(road.geometry), ratio, flow, color, 1, road.roundabout, 0.0));
            return;
        }

        for (int lane = 0; lane < lanes; lane++) {
            double offset = LaneOffsetter.laneOffset(lane, lanes, laneWidth);
            List<Coordinate> line = offsetter.offset(road.geometry, offset);
            out.add(new CongestionFeature(lineString(line), ratio, flow, color, lanes, road.roundabout, offset));
        }
    }

    private LineString lineString(List<Coordinate> coords) {
        return geometryFactory.createLineString(coords.toArray(new Coordinate[0]));
    }
}
