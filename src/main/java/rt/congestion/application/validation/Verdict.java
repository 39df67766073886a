package rt.congestion.application.validation;

/*
 * Bewertung eines Korridors: simuliert / Referenz.
 */
public enum Verdict {
    GOOD("good"),
    NEEDS_TUNING("needs tuning"),
    UNDER_CONGESTED("model under-congests"),
    NO_DATA("no data");

    public static final double GOOD_BELOW = 1.5;
    public static final double TUNING_BELOW = 2.5;

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Verdict forRatio(double ratio) {
        if (ratio < GOOD_BELOW) {
            return GOOD;
        }
        if (ratio < TUNING_BELOW) {
            return NEEDS_TUNING;
        }
        return UNDER_CONGESTED;
    }
}
