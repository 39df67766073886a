package rt.congestion.backend.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.geom.Coordinate;

/*
 * RoadNetwork
 *
 * Statische Netzdaten, nach dem Laden nur noch gelesen
 * (SegmentGeometryBuilder + Validator teilen sich eine Instanz).
 * Reihenfolge der Segmente = Reihenfolge in der net.xml.
 */
public final class RoadNetwork {

    private final Map<String, RoadSegment> segments;
    private final NetworkProjection projection;

    public RoadNetwork(Collection<RoadSegment> segments, NetworkProjection projection) {
        Map<String, RoadSegment> byId = new LinkedHashMap<>();
        for (RoadSegment s : segments) {
            byId.put(s.id, s);
        }
        this.segments = Collections.unmodifiableMap(byId);
        this.projection = projection;
    }

    public RoadSegment getSegment(String id) {
        return segments.get(id);
    }

    public boolean contains(String id) {
        return segments.containsKey(id);
    }

    public Collection<RoadSegment> getSegments() {
        return segments.values();
    }

    public int size() {
        return segments.size();
    }

    public NetworkProjection getProjection() {
        return projection;
    }

    /**
     * @return the segment shape converted to lon/lat
     */
    public List<Coordinate> toLonLat(RoadSegment segment) {
        List<Coordinate> result = new ArrayList<>(segment.shape.size());
        for (Coordinate c : segment.shape) {
            result.add(projection.toLonLat(c.x, c.y));
        }
        return result;
    }

    /**
     * @return first shape vertex in lon/lat, null for an empty shape
     */
    public Coordinate firstPointLonLat(RoadSegment segment) {
        if (segment.shape.isEmpty()) {
            return null;
        }
        Coordinate c = segment.shape.get(0);
        return projection.toLonLat(c.x, c.y);
    }
}
