package rt.congestion.application.trajectory;

import org.locationtech.jts.geom.Coordinate;

/*
 * Rechnet eine Trace-Position (x/y) in lon/lat um.
 */
@FunctionalInterface
public interface PositionConverter {

    /** Trace liefert schon lon/lat (fcd-output.geo). */
    PositionConverter GEO = (x, y) -> new Coordinate(x, y);

    /**
     * @return x = lon, y = lat
     */
    Coordinate toLonLat(double x, double y);
}
