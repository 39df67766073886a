package rt.congestion.application.analytics;

/*
 * SegmentAggregate
 *
 * Laufende Summe der Geschwindigkeiten (km/h) und Anzahl Samples einer Kante.
 * Existiert nur, wenn mindestens ein Sample gefaltet wurde.
 */
public final class SegmentAggregate {

    public final String segmentId;

    private double speedSumKmh;
    private int sampleCount;

    SegmentAggregate(String segmentId) {
        this.segmentId = segmentId;
    }

    void add(double speedKmh) {
        speedSumKmh += speedKmh;
        sampleCount++;
    }

    public double getSpeedSumKmh() {
        return speedSumKmh;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    /**
     * @return mean speed in km/h (sum / count)
     */
    public double getMeanSpeedKmh() {
        return speedSumKmh / sampleCount;
    }
}
