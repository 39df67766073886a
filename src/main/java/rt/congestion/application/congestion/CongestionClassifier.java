package rt.congestion.application.congestion;

import java.util.Arrays;

/*
 * CongestionClassifier
 *
 * Speed-Ratio -> Stau-Stufe + Farbe.
 *
 *   ratio < t0 -> JAMMED
 *   ratio < t1 -> HEAVY
 *   ...
 *   sonst      -> FREE
 *
 * Genau auf einer Schwelle landet man in der nächsten (weniger schweren) Stufe.
 */
public final class CongestionClassifier {

    public static final double[] DEFAULT_THRESHOLDS = { 0.25, 0.45, 0.60, 0.75, 0.90 };

    private static final CongestionBand[] BANDS = CongestionBand.values();

    private final double[] thresholds;
    private final int[][] colors;

    public CongestionClassifier() {
        this(DEFAULT_THRESHOLDS, defaultColors());
    }

    /**
     * @param thresholds five strictly ascending upper bounds
     * @param colors     six [r,g,b] colors, one per band
     */
    public CongestionClassifier(double[] thresholds, int[][] colors) {
        if (thresholds == null || thresholds.length != BANDS.length - 1) {
            throw new IllegalArgumentException("expected " + (BANDS.length - 1) + " thresholds");
        }
        for (int i = 1; i < thresholds.length; i++) {
            if (thresholds[i] <= thresholds[i - 1]) {
                throw new IllegalArgumentException("thresholds must be strictly ascending: " + Arrays.toString(thresholds));
            }
        }
        if (colors == null || colors.length != BANDS.length) {
            throw new IllegalArgumentException("expected " + BANDS.length + " colors");
        }

        this.thresholds = thresholds.clone();
        this.colors = new int[colors.length][];
        for (int i = 0; i < colors.length; i++) {
            if (colors[i] == null || colors[i].length != 3) {
                throw new IllegalArgumentException("color " + i + " is not [r,g,b]");
            }
            this.colors[i] = colors[i].clone();
        }
    }

    public CongestionBand classify(double speedRatio) {
        for (int i = 0; i < thresholds.length; i++) {
            if (speedRatio < thresholds[i]) {
                return BANDS[i];
            }
        }
        return CongestionBand.FREE;
    }

    public int[] colorOf(CongestionBand band) {
        return colors[band.ordinal()].clone();
    }

    public int[] colorFor(double speedRatio) {
        return colorOf(classify(speedRatio));
    }

    private static int[][] defaultColors() {
        int[][] result = new int[BANDS.length][];
        for (CongestionBand band : BANDS) {
            result[band.ordinal()] = band.defaultColor();
        }
        return result;
    }
}
