package rt.congestion.application.window;

/*
 * Ergebnis der Fenster-Prüfung für einen Timestep.
 */
public enum WindowMembership {
    NONE(false, false),
    TRAJECTORY(true, false),
    AGGREGATION(false, true),
    BOTH(true, true);

    private final boolean trajectory;
    private final boolean aggregation;

    WindowMembership(boolean trajectory, boolean aggregation) {
        this.trajectory = trajectory;
        this.aggregation = aggregation;
    }

    public static WindowMembership of(boolean trajectory, boolean aggregation) {
        if (trajectory) {
            return aggregation ? BOTH : TRAJECTORY;
        }
        return aggregation ? AGGREGATION : NONE;
    }

    public boolean trajectory() {
        return trajectory;
    }

    public boolean aggregation() {
        return aggregation;
    }

    public boolean any() {
        return trajectory || aggregation;
    }
}
