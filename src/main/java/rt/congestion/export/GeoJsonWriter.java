package rt.congestion.export;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import rt.congestion.application.geometry.CongestionFeature;

/*
 * GeoJsonWriter
 *
 * Stau-Karte als kompakte GeoJSON FeatureCollection, eine LineString pro Spur:
 *   {"type":"FeatureCollection","features":[
 *     {"type":"Feature",
 *      "geometry":{"type":"LineString","coordinates":[[lon,lat],...]},
 *      "properties":{"speed_ratio":0.512,"peak_flow":12,"color":[255,136,0],
 *                    "lane_count":2,"is_roundabout":false}}]}
 */
public final class GeoJsonWriter {

    private final JsonFactory factory = new JsonFactory();

    public void write(List<CongestionFeature> features, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            write(features, out);
        }
    }

    public void write(List<CongestionFeature> features, OutputStream out) throws IOException {
        try (JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
            gen.writeStartObject();
            gen.writeStringField("type", "FeatureCollection");
            gen.writeArrayFieldStart("features");

            for (CongestionFeature f : features) {
                gen.writeStartObject();
                gen.writeStringField("type", "Feature");

                gen.writeObjectFieldStart("geometry");
                gen.writeStringField("type", "LineString");
                gen.writeArrayFieldStart("coordinates");
                for (Coordinate c : f.geometry.getCoordinates()) {
                    gen.writeStartArray();
                    gen.writeNumber(c.x);
                    gen.writeNumber(c.y);
                    gen.writeEndArray();
                }
                gen.writeEndArray();
                gen.writeEndObject();

                gen.writeObjectFieldStart("properties");
                gen.writeNumberField("speed_ratio", f.speedRatio);
                gen.writeNumberField("peak_flow", f.peakFlow);
                gen.writeArrayFieldStart("color");
                for (int channel : f.color) {
                    gen.writeNumber(channel);
                }
                gen.writeEndArray();
                gen.writeNumberField("lane_count", f.laneCount);
                gen.writeBooleanField("is_roundabout", f.roundabout);
                gen.writeEndObject();

                gen.writeEndObject();
            }

            gen.writeEndArray();
            gen.writeEndObject();
        }
    }
}
