package rt.congestion.application.trajectory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/*
 * Trajectory
 *
 * Geordnete Waypoints eines Fahrzeugs.
 * Bei tausenden Fahrzeugen mit je tausenden Sekunden wären Objekte pro Punkt zu teuer,
 * deshalb parallele primitive Arrays, die bei Bedarf wachsen.
 *
 * Invariante: Sekunden streng aufsteigend.
 */
public final class Trajectory {

    private static final int INITIAL_CAPACITY = 16;

    public final String vehicleId;

    private int[] seconds = new int[INITIAL_CAPACITY];
    private double[] lons = new double[INITIAL_CAPACITY];
    private double[] lats = new double[INITIAL_CAPACITY];
    private float[] speeds = new float[INITIAL_CAPACITY];
    private int size = 0;

    public Trajectory(String vehicleId) {
        this.vehicleId = vehicleId;
    }

    /**
     * Appends a waypoint.
     *
     * @return false if the second is not after the last one (point dropped)
     */
    boolean append(int second, double lon, double lat, double speedKmh) {
        if (size > 0 && second <= seconds[size - 1]) {
            return false;
        }
        if (size == seconds.length) {
            int newCapacity = seconds.length * 2;
            seconds = Arrays.copyOf(seconds, newCapacity);
            lons = Arrays.copyOf(lons, newCapacity);
            lats = Arrays.copyOf(lats, newCapacity);
            speeds = Arrays.copyOf(speeds, newCapacity);
        }
        seconds[size] = second;
        lons[size] = lon;
        lats[size] = lat;
        speeds[size] = (float) speedKmh;
        size++;
        return true;
    }

    public int size() {
        return size;
    }

    public int secondAt(int i) {
        checkIndex(i);
        return seconds[i];
    }

    public double lonAt(int i) {
        checkIndex(i);
        return lons[i];
    }

    public double latAt(int i) {
        checkIndex(i);
        return lats[i];
    }

    public double speedKmhAt(int i) {
        checkIndex(i);
        // float -> double würde 36.1 als 36.099998... liefern, also wieder auf 1 Stelle
        return Math.round(speeds[i] * 10.0) / 10.0;
    }

    /**
     * @return an unmodifiable copy of all waypoints
     */
    public List<Waypoint> getWaypoints() {
        List<Waypoint> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(new Waypoint(seconds[i], lons[i], lats[i], speedKmhAt(i)));
        }
        return Collections.unmodifiableList(result);
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= size) {
            throw new IndexOutOfBoundsException("Waypoint " + i + " of " + size);
        }
    }
}
