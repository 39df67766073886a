package rt.congestion.application.window;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import rt.congestion.config.WindowSpec;

/*
 * WindowFilter
 *
 * Entscheidet pro Timestep (nicht pro Fahrzeugzeile):
 * - Trajektorien-Fenster : start - buffer <= t <= end + buffer, und die gespeicherte
 *                          volle Sekunde floor(t) liegt ebenfalls im Fenster
 * - Aggregations-Fenster : t liegt in einem Peak-Fenster UND t ist eine volle
 *                          Sekunde mit t mod stride == 0
 *
 * Dazu der Horizont für den Early-Stop: spätestes (end + buffer) aller aktiven Fenster.
 * Da die Zeit im Trace monoton ist, kommt danach nichts mehr, was irgendein Fenster braucht.
 */
public final class WindowFilter {

    private final WindowSpec trajectoryWindow;
    private final List<WindowSpec> aggregationWindows;
    private final double horizon;

    /**
     * @param trajectoryWindow   window for trajectory collection, null disables it
     * @param aggregationWindows peak windows for speed aggregation, empty disables it
     */
    public WindowFilter(WindowSpec trajectoryWindow, List<WindowSpec> aggregationWindows) {
        this.trajectoryWindow = trajectoryWindow;
        this.aggregationWindows = aggregationWindows == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(aggregationWindows));

        double h = Double.NEGATIVE_INFINITY;
        if (trajectoryWindow != null) {
            h = Math.max(h, trajectoryWindow.bufferedEnd());
        }
        for (WindowSpec w : this.aggregationWindows) {
            h = Math.max(h, w.bufferedEnd());
        }
        this.horizon = h;
    }

    public WindowMembership evaluate(double t) {
        return WindowMembership.of(inTrajectoryWindow(t), inAggregationWindow(t));
    }

    public boolean inTrajectoryWindow(double t) {
        return trajectoryWindow != null
                && trajectoryWindow.contains(t)
                && trajectoryWindow.contains(Math.floor(t));
    }

    public boolean inAggregationWindow(double t) {
        for (WindowSpec w : aggregationWindows) {
            if (w.contains(t) && onStride(t, w.stride)) {
                return true;
            }
        }
        return false;
    }

    // Sub-Sekunden-Steps (step-length 0.1) sollen nicht 10x pro Sekunde zählen
    private static boolean onStride(double t, int stride) {
        if (t != Math.rint(t)) {
            return false;
        }
        return ((long) t) % stride == 0;
    }

    /**
     * @return latest buffered window end; negative infinity when no window is active
     */
    public double horizon() {
        return horizon;
    }

    public boolean isPastHorizon(double t) {
        return t > horizon;
    }

    public boolean collectsTrajectories() {
        return trajectoryWindow != null;
    }

    public boolean collectsAggregates() {
        return !aggregationWindows.isEmpty();
    }
}
