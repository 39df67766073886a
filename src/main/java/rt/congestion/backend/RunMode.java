package rt.congestion.backend;

import java.util.Locale;

/**
 * Was ein Lauf produziert.
 *
 * - FULL         : Trajektorien + Stau-Karte + Validierung
 * - TRAJECTORIES : nur trips_deckgl.json, das Netz wird nur bei projizierten Koordinaten gebraucht
 * - CONGESTION   : Kanten-Tabelle, Stau-Karte und Validierung, keine Trajektorien
 */
public enum RunMode {
    FULL,
    TRAJECTORIES,
    CONGESTION;

    public boolean trajectories() {
        return this != CONGESTION;
    }

    public boolean congestion() {
        return this != TRAJECTORIES;
    }

    /**
     * @throws IllegalArgumentException for unknown names
     */
    public static RunMode parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown mode '" + name + "' (full, trajectories, congestion)", ex);
        }
    }
}
