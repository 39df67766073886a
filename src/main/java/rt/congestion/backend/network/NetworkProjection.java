package rt.congestion.backend.network;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

import rt.congestion.application.trajectory.PositionConverter;

/*
 * NetworkProjection
 *
 * SUMO speichert Koordinaten projiziert und um netOffset verschoben:
 *   <location netOffset="-500000.00,-5200000.00" projParameter="+proj=utm +zone=35 ..."/>
 *
 * Rückweg nach lon/lat:
 *   1) netOffset abziehen
 *   2) inverse Projektion (proj4j) nach WGS84
 *
 * projParameter "!" heißt: keine Projektion, die Koordinaten sind (nach Offset) schon lon/lat.
 */
public final class NetworkProjection implements PositionConverter {

    public static final String NO_PROJECTION = "!";

    private static final String WGS84 = "+proj=longlat +datum=WGS84 +no_defs";

    private final double offsetX;
    private final double offsetY;
    private final String projParameter;

    // proj4j Transform ist nicht thread-safe, wir scannen aber single-threaded
    private final CoordinateTransform inverse;
    private final ProjCoordinate scratchIn = new ProjCoordinate();
    private final ProjCoordinate scratchOut = new ProjCoordinate();

    public NetworkProjection(double offsetX, double offsetY, String projParameter) {
        this.offsetX = offsetX;
        this.offsetY = offsetY;
        this.projParameter = projParameter == null || projParameter.isBlank() ? NO_PROJECTION : projParameter.trim();
        this.inverse = createInverse(this.projParameter);
    }

    /**
     * Projection without offset and without map projection, used when the network
     * already stores lon/lat.
     */
    public static NetworkProjection identity() {
        return new NetworkProjection(0.0, 0.0, NO_PROJECTION);
    }

    private static CoordinateTransform createInverse(String projParameter) {
        if (NO_PROJECTION.equals(projParameter)) {
            return null;
        }
        try {
            CRSFactory crsFactory = new CRSFactory();
            CoordinateReferenceSystem net = crsFactory.createFromParameters("sumo-net", projParameter);
            CoordinateReferenceSystem wgs84 = crsFactory.createFromParameters("WGS84", WGS84);
            return new CoordinateTransformFactory().createTransform(net, wgs84);
        } catch (Proj4jException ex) {
            throw new IllegalStateException("Unsupported projParameter in net file: " + projParameter, ex);
        }
    }

    /**
     * @return x = lon, y = lat
     */
    @Override
    public Coordinate toLonLat(double x, double y) {
        double px = x - offsetX;
        double py = y - offsetY;

        if (inverse == null) {
            return new Coordinate(px, py);
        }

        scratchIn.x = px;
        scratchIn.y = py;
        inverse.transform(scratchIn, scratchOut);
        return new Coordinate(scratchOut.x, scratchOut.y);
    }

    public boolean isProjected() {
        return inverse != null;
    }

    public String getProjParameter() {
        return projParameter;
    }
}
