package rt.congestion.application.trajectory;

/*
 * Waypoint
 *
 * Ein Punkt einer Fahrzeug-Trajektorie: (Sekunde, lon, lat, km/h).
 */
public final class Waypoint {

    public final int second;
    public final double lon;
    public final double lat;
    public final double speedKmh;

    public Waypoint(int second, double lon, double lat, double speedKmh) {
        this.second = second;
        this.lon = lon;
        this.lat = lat;
        this.speedKmh = speedKmh;
    }

    @Override
    public String toString() {
        return "[" + second + "," + lon + "," + lat + "," + speedKmh + "]";
    }
}
