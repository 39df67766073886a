package rt.congestion.application.validation;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import rt.congestion.application.analytics.EdgeCongestion;
import rt.congestion.application.analytics.EdgeCongestionTable;
import rt.congestion.backend.network.RoadNetwork;
import rt.congestion.backend.network.RoadSegment;
import rt.congestion.config.CorridorSpec;

/*
 * Validator
 *
 * Vergleicht die simulierten Peak-Geschwindigkeiten mit extern gemessenen Werten:
 * - Repräsentant einer Kante = erster Shape-Punkt (lon/lat)
 * - simuliert = Mittel der mittleren Geschwindigkeiten aller Kanten in der Box
 * - ratio = simuliert / Referenz -> Verdict
 *
 * Reine Diagnose, ändert keinen Output der Pipeline.
 */
public final class Validator {

    private final List<CorridorSpec> corridors;

    public Validator(List<CorridorSpec> corridors) {
        this.corridors = List.copyOf(corridors);
    }

    public ValidationReport validate(RoadNetwork network, EdgeCongestionTable table) {

        // Repräsentanten einmal berechnen, nicht pro Korridor
        List<Coordinate> points = new ArrayList<>();
        List<Double> speeds = new ArrayList<>();
        for (EdgeCongestion row : table.getRows()) {
            RoadSegment segment = network.getSegment(row.edgeId);
            if (segment == null) {
                continue;
            }
            Coordinate p = network.firstPointLonLat(segment);
            if (p == null) {
                continue;
            }
            points.add(p);
            speeds.add(row.meanSpeedKmh);
        }

        List<CorridorResult> results = new ArrayList<>(corridors.size());
        for (CorridorSpec corridor : corridors) {
            Envelope box = corridor.toEnvelope();

            double sum = 0.0;
            int matched = 0;
            for (int i = 0; i < points.size(); i++) {
                if (box.covers(points.get(i))) {
                    sum += speeds.get(i);
                    matched++;
                }
            }

            if (matched == 0) {
                results.add(CorridorResult.noData(corridor.name, corridor.referenceSpeedKmh));
            } else {
                results.add(CorridorResult.measured(corridor.name, corridor.referenceSpeedKmh, sum / matched, matched));
            }
        }

        return new ValidationReport(results);
    }
}
