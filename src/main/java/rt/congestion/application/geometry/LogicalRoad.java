package rt.congestion.application.geometry;

import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

import rt.congestion.backend.network.RoadSegment;

/*
 * LogicalRoad
 *
 * Eine physische Straße aus mehreren Segmenten derselben Gruppe:
 * - Segmente in Fahrtreihenfolge (splitIndex)
 * - zusammengefügte lon/lat-Polyline
 * - längengewichtete Speed-Ratio und Fluss
 */
public final class LogicalRoad {

    public final RoadGroupKey key;
    public final List<RoadSegment> segments;
    public final List<Coordinate> geometry;
    public final double speedRatio;
    public final double peakFlow;
    public final boolean roundabout;

    public LogicalRoad(RoadGroupKey key, List<RoadSegment> segments, List<Coordinate> geometry,
            double speedRatio, double peakFlow, boolean roundabout) {
        this.key = key;
        this.segments = Collections.unmodifiableList(segments);
        this.geometry = Collections.unmodifiableList(geometry);
        this.speedRatio = speedRatio;
        this.peakFlow = peakFlow;
        this.roundabout = roundabout;
    }

    public int getLaneCount() {
        return key.laneCount;
    }
}
