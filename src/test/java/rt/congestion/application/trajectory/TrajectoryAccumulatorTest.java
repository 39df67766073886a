package rt.congestion.application.trajectory;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

class TrajectoryAccumulatorTest {

    private final TrajectoryAccumulator acc = new TrajectoryAccumulator(PositionConverter.GEO, 5);

    private void drive(String id, int waypoints) {
        for (int i = 0; i < waypoints; i++) {
            acc.add(id, 100 + i, 28.8 + i * 0.001, 47.0, 10.0);
        }
    }

    private static List<String> ids(List<Trajectory> trajectories) {
        List<String> result = new ArrayList<>();
        for (Trajectory t : trajectories) {
            result.add(t.vehicleId);
        }
        return result;
    }

    @Test
    @DisplayName("Vehicle seen at five sampled seconds keeps all five waypoints")
    void keepsFiveWaypoints() {
        int[] seconds = { 100, 130, 160, 190, 220 };
        for (int s : seconds) {
            acc.add("veh0", s, 28.83, 46.97, 10.0);
        }

        List<Trajectory> result = acc.finish(5, 8000);

        assertEquals(1, result.size());
        Trajectory t = result.get(0);
        assertEquals(5, t.size());
        for (int i = 0; i < seconds.length; i++) {
            assertEquals(seconds[i], t.secondAt(i));
            assertEquals(36.0, t.speedKmhAt(i), 0.0);
        }
    }

    @Test
    void dropsShortTrajectories() {
        drive("short", 4);
        drive("long", 5);

        assertEquals(List.of("long"), ids(acc.finish(5, 8000)));
    }

    @Test
    void roundsCoordinatesAndSpeed() {
        acc.add("v", 1, 28.8312345, 46.9765432, 13.41);

        Waypoint w = acc.finish(1, 1).get(0).getWaypoints().get(0);
        assertEquals(28.83123, w.lon, 0.0);
        assertEquals(46.97654, w.lat, 0.0);
        assertEquals(48.3, w.speedKmh, 0.0);
    }

    @Test
    void duplicateSecondKeepsFirstWaypoint() {
        acc.add("v", 10, 28.1, 47.0, 5.0);
        acc.add("v", 10, 28.2, 47.0, 6.0);
        acc.add("v", 9, 28.3, 47.0, 7.0);
        acc.add("v", 11, 28.4, 47.0, 8.0);

        Trajectory t = acc.finish(1, 10).get(0);
        assertEquals(2, t.size());
        assertEquals(28.1, t.lonAt(0), 0.0);
        assertEquals(11, t.secondAt(1));
        assertEquals(2, acc.getDroppedWaypoints());
        assertEquals(2, acc.getAcceptedWaypoints());
    }

    @Test
    @DisplayName("Cap keeps the most active vehicles, ties by id, output in first-seen order")
    void capKeepsMostActive() {
        drive("c", 6);
        drive("b", 5);
        drive("a", 5);
        drive("d", 7);

        List<Trajectory> result = acc.finish(5, 3);

        assertEquals(List.of("c", "a", "d"), ids(result));
    }

    @Test
    void belowCapNothingIsRemoved() {
        drive("z", 5);
        drive("y", 9);
        drive("x", 6);

        assertEquals(List.of("z", "y", "x"), ids(acc.finish(5, 10)));
        assertEquals(3, acc.trackedVehicles());
    }

    @Test
    void unconvertiblePositionsAreDropped() {
        TrajectoryAccumulator broken = new TrajectoryAccumulator((x, y) -> new Coordinate(Double.NaN, y), 5);
        broken.add("v", 1, 1.0, 2.0, 3.0);

        assertEquals(0, broken.trackedVehicles());
        assertEquals(1, broken.getDroppedWaypoints());
    }

    @Test
    void trajectoryGrowsBeyondInitialCapacity() {
        drive("long", 100);

        Trajectory t = acc.finish(5, 1).get(0);
        assertEquals(100, t.size());
        assertEquals(199, t.secondAt(99));
        assertThrows(IndexOutOfBoundsException.class, () -> t.secondAt(100));
    }
}
