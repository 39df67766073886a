package rt.congestion.export;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import rt.congestion.application.trajectory.Trajectory;

/*
 * TrajectoryWriter
 *
 * Schreibt die Trajektorien kompakt (ohne Whitespace) für die Playback-Ansicht:
 *   [{"id":"veh0","waypoints":[[25200,28.83,46.97,36.1],...]},...]
 *
 * Streaming über JsonGenerator, es wird kein Baum im Speicher aufgebaut.
 */
public final class TrajectoryWriter {

    private final JsonFactory factory = new JsonFactory();

    public void write(List<Trajectory> trajectories, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            write(trajectories, out);
        }
    }

    public void write(List<Trajectory> trajectories, OutputStream out) throws IOException {
        try (JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
            gen.writeStartArray();
            for (Trajectory t : trajectories) {
                gen.writeStartObject();
                gen.writeStringField("id", t.vehicleId);
                gen.writeArrayFieldStart("waypoints");
                for (int i = 0; i < t.size(); i++) {
                    gen.writeStartArray();
                    gen.writeNumber(t.secondAt(i));
                    gen.writeNumber(t.lonAt(i));
                    gen.writeNumber(t.latAt(i));
                    gen.writeNumber(t.speedKmhAt(i));
                    gen.writeEndArray();
                }
                gen.writeEndArray();
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
    }
}
