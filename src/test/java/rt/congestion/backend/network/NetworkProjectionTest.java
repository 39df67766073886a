package rt.congestion.backend.network;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

class NetworkProjectionTest {

    private static final String UTM35 = "+proj=utm +zone=35 +ellps=WGS84 +datum=WGS84 +units=m +no_defs";

    @Test
    void centralMeridianOfZone35() {
        NetworkProjection projection = new NetworkProjection(0.0, 0.0, UTM35);

        Coordinate lonLat = projection.toLonLat(500000.0, 5200000.0);

        assertEquals(27.0, lonLat.x, 1e-9);
        assertEquals(46.94, lonLat.y, 0.05);
    }

    @Test
    void offsetIsSubtractedFirst() {
        NetworkProjection withOffset = new NetworkProjection(-500000.0, -5200000.0, UTM35);
        NetworkProjection plain = new NetworkProjection(0.0, 0.0, UTM35);

        Coordinate a = withOffset.toLonLat(1234.0, 5678.0);
        Coordinate b = plain.toLonLat(501234.0, 5205678.0);

        assertEquals(b.x, a.x, 1e-12);
        assertEquals(b.y, a.y, 1e-12);
    }

    @Test
    void exclamationMarkMeansNoProjection() {
        NetworkProjection identity = new NetworkProjection(-1.0, 2.0, "!");

        assertFalse(identity.isProjected());
        assertEquals(new Coordinate(29.8, 45.0), identity.toLonLat(28.8, 47.0));
        assertEquals(NetworkProjection.NO_PROJECTION, new NetworkProjection(0, 0, " ").getProjParameter());
    }

    @Test
    void unknownProjectionFails() {
        assertThrows(IllegalStateException.class, () -> new NetworkProjection(0, 0, "+proj=doesnotexist"));
    }
}
