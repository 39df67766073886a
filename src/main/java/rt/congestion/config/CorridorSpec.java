package rt.congestion.config;

import org.locationtech.jts.geom.Envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/*
 * CorridorSpec
 *
 * Referenz-Korridor für die Validierung:
 * Bounding-Box in lon/lat + extern gemessene Geschwindigkeit (km/h).
 */
public final class CorridorSpec {

    public final String name;
    public final double minLon;
    public final double maxLon;
    public final double minLat;
    public final double maxLat;
    public final double referenceSpeedKmh;

    @JsonCreator
    public CorridorSpec(
            @JsonProperty("name") String name,
            @JsonProperty("minLon") double minLon,
            @JsonProperty("maxLon") double maxLon,
            @JsonProperty("minLat") double minLat,
            @JsonProperty("maxLat") double maxLat,
            @JsonProperty("referenceSpeedKmh") double referenceSpeedKmh) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Corridor without name");
        }
        if (referenceSpeedKmh <= 0) {
            throw new IllegalArgumentException("Corridor " + name + ": reference speed must be positive");
        }
        this.name = name;
        this.minLon = minLon;
        this.maxLon = maxLon;
        this.minLat = minLat;
        this.maxLat = maxLat;
        this.referenceSpeedKmh = referenceSpeedKmh;
    }

    // Envelope(x1, x2, y1, y2) -> x = lon, y = lat
    public Envelope toEnvelope() {
        return new Envelope(minLon, maxLon, minLat, maxLat);
    }
}
