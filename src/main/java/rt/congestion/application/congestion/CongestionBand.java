package rt.congestion.application.congestion;

/*
 * Stau-Stufen, von schwer nach frei geordnet.
 * Die Farben sind die Default-Palette, die Config kann sie ersetzen.
 */
public enum CongestionBand {
    JAMMED(204, 0, 0),
    HEAVY(255, 68, 0),
    SLOW(255, 136, 0),
    MODERATE(255, 187, 0),
    LIGHT(136, 204, 0),
    FREE(0, 170, 68);

    private final int[] defaultColor;

    CongestionBand(int r, int g, int b) {
        this.defaultColor = new int[] { r, g, b };
    }

    public int[] defaultColor() {
        return defaultColor.clone();
    }
}
