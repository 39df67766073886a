package rt.congestion.application.geometry;

import org.locationtech.jts.geom.LineString;

/*
 * CongestionFeature
 *
 * Eine gezeichnete Linie (eine pro Fahrspur) mit ihren Properties.
 */
public final class CongestionFeature {

    public final LineString geometry;
    public final double speedRatio;
    public final int peakFlow;
    public final int[] color;
    public final int laneCount;
    public final boolean roundabout;

    // Versatz der Spur zur Straßenmitte in Metern (nicht exportiert)
    public final double offsetMeters;

    public CongestionFeature(LineString geometry, double speedRatio, int peakFlow, int[] color,
            int laneCount, boolean roundabout, double offsetMeters) {
        this.geometry = geometry;
        this.speedRatio = speedRatio;
        this.peakFlow = peakFlow;
        this.color = color;
        this.laneCount = laneCount;
        this.roundabout = roundabout;
        this.offsetMeters = offsetMeters;
    }
}
