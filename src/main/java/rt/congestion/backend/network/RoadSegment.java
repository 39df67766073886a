package rt.congestion.backend.network;

import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

/*
 * RoadSegment
 *
 * Eine (nicht interne) Kante aus der net.xml:
 * - id            : z.B. "-123456#2"
 * - laneCount     : Anzahl <lane> Kinder
 * - speedMs       : erlaubte Geschwindigkeit (max. über die Lanes) in m/s
 * - lengthM       : Länge in Metern
 * - shape         : projizierte Polyline (Netz-Koordinaten)
 * - roundabout    : Teil eines <roundabout>
 */
public final class RoadSegment {

    public final String id;
    public final int laneCount;
    public final double speedMs;
    public final double lengthM;
    public final List<Coordinate> shape;
    public final boolean roundabout;

    public RoadSegment(String id, int laneCount, double speedMs, double lengthM,
            List<Coordinate> shape, boolean roundabout) {
        this.id = id;
        this.laneCount = laneCount;
        this.speedMs = speedMs;
        this.lengthM = lengthM;
        this.shape = Collections.unmodifiableList(shape);
        this.roundabout = roundabout;
    }

    /**
     * Direction marker: SUMO names the reverse direction of an OSM way with a leading '-'.
     */
    public boolean isReverse() {
        return id.startsWith("-");
    }

    public double getFreeflowKmh() {
        return speedMs * 3.6;
    }

    @Override
    public String toString() {
        return "RoadSegment[" + id + ", lanes=" + laneCount + ", " + shape.size() + " pts]";
    }
}
