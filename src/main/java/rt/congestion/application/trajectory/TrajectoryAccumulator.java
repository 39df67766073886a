package rt.congestion.application.trajectory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
 * TrajectoryAccumulator
 *
 * - sammelt pro Fahrzeug die Waypoints im Trajektorien-Fenster
 * - gehört exklusiv dem Scan-Loop, gelesen wird erst nach finish()
 *
 * Finalisierung:
 * - weniger als minWaypoints -> raus
 * - mehr als maxVehicles übrig -> die mit den meisten Waypoints behalten,
 *   bei Gleichstand entscheidet die Fahrzeug-ID (aufsteigend)
 * - Ausgabe bleibt in der Reihenfolge, in der die Fahrzeuge zuerst gesehen wurden
 */
public class TrajectoryAccumulator {

    private static final Logger LOG = LoggerFactory.getLogger(TrajectoryAccumulator.class);

    // Vehicle-Id -> Trajektorie, LinkedHashMap hält "first seen" Reihenfolge
    private final Map<String, Trajectory> trajectories = new LinkedHashMap<>();

    private final PositionConverter converter;
    private final double coordinateFactor;

    private long acceptedWaypoints = 0;
    private long droppedWaypoints = 0;

    /**
     * @param converter          trace x/y to lon/lat
     * @param coordinateDecimals decimals kept for lon/lat
     */
    public TrajectoryAccumulator(PositionConverter converter, int coordinateDecimals) {
        this.converter = converter;
        this.coordinateFactor = Math.pow(10, coordinateDecimals);
    }

    /**
     * Folds one in-window sample into the vehicle's trajectory.
     *
     * @param vehicleId     vehicle id from the trace
     * @param second        simulated second (truncated)
     * @param x             trace x (lon or projected)
     * @param y             trace y (lat or projected)
     * @param speedMetersPerSecond speed in m/s
     */
    public void add(String vehicleId, int second, double x, double y, double speedMetersPerSecond) {
        Coordinate lonLat = converter.toLonLat(x, y);
        if (lonLat == null || Double.isNaN(lonLat.x) || Double.isNaN(lonLat.y)) {
            droppedWaypoints++;
            return;
        }

        double lon = round(lonLat.x, coordinateFactor);
        double lat = round(lonLat.y, coordinateFactor);
        double speedKmh = round(speedMetersPerSecond * 3.6, 10.0);

        Trajectory t = trajectories.computeIfAbsent(vehicleId, Trajectory::new);
        if (t.append(second, lon, lat, speedKmh)) {
            acceptedWaypoints++;
        } else {
            // gleiche Sekunde nochmal (step-length < 1s) -> nur der erste zählt
            droppedWaypoints++;
        }
    }

    public int trackedVehicles() {
        return trajectories.size();
    }

    public long getAcceptedWaypoints() {
        return acceptedWaypoints;
    }

    public long getDroppedWaypoints() {
        return droppedWaypoints;
    }

    /**
     * Applies the waypoint filter and the vehicle cap.
     *
     * @param minWaypoints minimum waypoints a trajectory needs
     * @param maxVehicles  maximum number of trajectories returned
     * @return retained trajectories in first-seen order
     */
    public List<Trajectory> finish(int minWaypoints, int maxVehicles) {

        // 1. zu kurze Trajektorien raus
        List<Trajectory> valid = new ArrayList<>();
        for (Trajectory t : trajectories.values()) {
            if (t.size() >= minWaypoints) {
                valid.add(t);
            }
        }

        LOG.info("[TRAJ] {} vehicles seen, {} with {}+ waypoints", trajectories.size(), valid.size(), minWaypoints);

        if (valid.size() <= maxVehicles) {
            return valid;
        }

        // 2. Cap: meiste Waypoints zuerst, dann ID
        List<Trajectory> ranked = new ArrayList<>(valid);
        ranked.sort(Comparator.comparingInt(Trajectory::size).reversed()
                .thenComparing(t -> t.vehicleId));

        Set<String> keep = new HashSet<>();
        for (int i = 0; i < maxVehicles; i++) {
            keep.add(ranked.get(i).vehicleId);
        }

        List<Trajectory> result = new ArrayList<>(maxVehicles);
        for (Trajectory t : valid) {
            if (keep.contains(t.vehicleId)) {
                result.add(t);
            }
        }

        LOG.info("[TRAJ] capped to the {} most active vehicles", maxVehicles);
        return result;
    }

    private static double round(double value, double factor) {
        return Math.round(value * factor) / factor;
    }
}
