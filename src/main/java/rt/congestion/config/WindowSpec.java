package rt.congestion.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/*
 * WindowSpec
 *
 * Ein benanntes Zeitfenster in Simulationssekunden:
 * - start / end  : inklusive Grenzen
 * - buffer       : symmetrischer Puffer um beide Grenzen
 * - stride       : nur jede stride-te Sekunde wird gesampelt (1 = alle)
 */
public final class WindowSpec {

    public final String name;
    public final double start;
    public final double end;
    public final double buffer;
    public final int stride;

    @JsonCreator
    public WindowSpec(
            @JsonProperty("name") String name,
            @JsonProperty("start") double start,
            @JsonProperty("end") double end,
            @JsonProperty("buffer") double buffer,
            @JsonProperty("stride") Integer stride) {
        this.name = name == null ? "window" : name;
        this.start = start;
        this.end = end;
        this.buffer = buffer;
        this.stride = stride == null ? 1 : stride;

        if (end < start) {
            throw new IllegalArgumentException("Window " + this.name + ": end < start (" + start + " > " + end + ")");
        }
        if (buffer < 0) {
            throw new IllegalArgumentException("Window " + this.name + ": negative buffer " + buffer);
        }
        if (this.stride <= 0) {
            throw new IllegalArgumentException("Window " + this.name + ": stride must be positive, was " + this.stride);
        }
    }

    public double bufferedStart() {
        return start - buffer;
    }

    public double bufferedEnd() {
        return end + buffer;
    }

    public boolean contains(double t) {
        return t >= bufferedStart() && t <= bufferedEnd();
    }

    @Override
    public String toString() {
        return name + "[" + start + ".." + end + " ±" + buffer + ", stride=" + stride + "]";
    }
}
