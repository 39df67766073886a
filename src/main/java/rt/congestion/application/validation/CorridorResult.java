package rt.congestion.application.validation;

import java.util.OptionalDouble;

/*
 * CorridorResult
 *
 * Ergebnis eines Referenz-Korridors. Ohne Daten sind simulatedSpeed und ratio leer.
 */
public final class CorridorResult {

    public final String name;
    public final double referenceSpeedKmh;
    public final OptionalDouble simulatedSpeedKmh;
    public final OptionalDouble ratio;
    public final Verdict verdict;
    public final int matchedEdges;

    private CorridorResult(String name, double referenceSpeedKmh, OptionalDouble simulatedSpeedKmh,
            OptionalDouble ratio, Verdict verdict, int matchedEdges) {
        this.name = name;
        this.referenceSpeedKmh = referenceSpeedKmh;
        this.simulatedSpeedKmh = simulatedSpeedKmh;
        this.ratio = ratio;
        this.verdict = verdict;
        this.matchedEdges = matchedEdges;
    }

    public static CorridorResult noData(String name, double referenceSpeedKmh) {
        return new CorridorResult(name, referenceSpeedKmh, OptionalDouble.empty(), OptionalDouble.empty(),
                Verdict.NO_DATA, 0);
    }

    public static CorridorResult measured(String name, double referenceSpeedKmh, double simulatedSpeedKmh,
            int matchedEdges) {
        double ratio = simulatedSpeedKmh / referenceSpeedKmh;
        return new CorridorResult(name, referenceSpeedKmh, OptionalDouble.of(simulatedSpeedKmh),
                OptionalDouble.of(ratio), Verdict.forRatio(ratio), matchedEdges);
    }

    public boolean hasData() {
        return verdict != Verdict.NO_DATA;
    }
}
