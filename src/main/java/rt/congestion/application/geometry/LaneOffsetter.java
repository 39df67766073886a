package rt.congestion.application.geometry;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

/*
 * LaneOffsetter
 *
 * Verschiebt eine lon/lat-Polyline parallel um offsetM Meter (links positiv).
 *
 * Idee (wie bei der Haltelinie):
 * - Richtung u an jedem Punkt: vorwärts am ersten, rückwärts am letzten, zentral dazwischen
 * - Normale n = (-uy, ux)
 * - Meter -> Grad über feste Faktoren (lon / lat getrennt)
 * - Richtung der Länge 0 -> Punkt bleibt wo er ist
 */
public final class LaneOffsetter {

    private final double lonDegreesPerMeter;
    private final double latDegreesPerMeter;

    public LaneOffsetter(double lonDegreesPerMeter, double latDegreesPerMeter) {
        this.lonDegreesPerMeter = lonDegreesPerMeter;
        this.latDegreesPerMeter = latDegreesPerMeter;
    }

    /**
     * @param laneIndex lane index 0..laneCount-1
     * @param laneCount lanes of the road
     * @param laneWidth width of one lane in meters
     * @return offset of the lane center from the road center, symmetric about zero
     */
    public static double laneOffset(int laneIndex, int laneCount, double laneWidth) {
        return (laneIndex - (laneCount - 1) / 2.0) * laneWidth;
    }

    public List<Coordinate> offset(List<Coordinate> coords, double offsetM) {
        int n = coords.size();
        List<Coordinate> result = new ArrayList<>(n);
        if (n < 2 || offsetM == 0.0) {
            for (Coordinate c : coords) {
                result.add(new Coordinate(c.x, c.y));
            }
            return result;
        }

        for (int i = 0; i < n; i++) {
            Coordinate prev = coords.get(i == 0 ? 0 : i - 1);
            Coordinate next = coords.get(i == n - 1 ? n - 1 : i + 1);

            double dx = next.x - prev.x;
            double dy = next.y - prev.y;
            double len = Math.hypot(dx, dy);

            Coordinate pt = coords.get(i);
            if (len == 0.0) {
                result.add(new Coordinate(pt.x, pt.y));
                continue;
            }

            // Normalenvektor (quer zur Richtung)
            double nx = -dy / len;
            double ny = dx / len;

            result.add(new Coordinate(
                    pt.x + nx * offsetM * lonDegreesPerMeter,
                    pt.y + ny * offsetM * latDegreesPerMeter));
        }
        return result;
    }
}
