package rt.congestion.application.geometry;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * RoadKeys
 *
 * Schlüssel aus SUMO Edge-IDs. netconvert baut IDs aus OSM-Ways so:
 *
 *   "123456"     Way 123456, Hinrichtung, ungeteilt
 *   "-123456"    Gegenrichtung
 *   "123456#2"   dritter Teil eines an Kreuzungen geteilten Ways
 *   "-123456#2"  dito in Gegenrichtung
 *   ":J5_0"      interne Kante in einer Junction
 *
 * Regeln:
 * - baseId      : die Ziffern am Anfang (ohne '-'), ohne Ziffern die ganze ID
 * - splitIndex  : Zahl hinter dem letzten '#' am Ende, sonst 0
 * - reverse     : ID beginnt mit '-'
 * - internal    : ID beginnt mit ':'
 */
public final class RoadKeys {

    public static final String INTERNAL_PREFIX = ":";

    private static final Pattern BASE_ID = Pattern.compile("^-?(\\d+)");
    private static final Pattern SPLIT_INDEX = Pattern.compile("#(\\d+)$");

    private RoadKeys() {
    }

    public static boolean isInternal(String edgeId) {
        return edgeId.startsWith(INTERNAL_PREFIX);
    }

    public static boolean isReverse(String edgeId) {
        return edgeId.startsWith("-");
    }

    public static String baseId(String edgeId) {
        Matcher m = BASE_ID.matcher(edgeId);
        if (m.find()) {
            return m.group(1);
        }
        return edgeId;
    }

    public static int splitIndex(String edgeId) {
        Matcher m = SPLIT_INDEX.matcher(edgeId);
        if (!m.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException ex) {
            // mehr Ziffern als int -> wie "kein Index"
            return 0;
        }
    }
}
