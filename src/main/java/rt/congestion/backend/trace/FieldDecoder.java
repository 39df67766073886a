package rt.congestion.backend.trace;

import java.util.Optional;
import java.util.OptionalDouble;

/*
 * FieldDecoder
 *
 * Liest einzelne Attribute aus einer FCD-Zeile, ohne die Zeile als XML zu parsen:
 *   <vehicle id="veh0" x="28.83" y="46.97" speed="12.3" lane="123#0_1" .../>
 *
 * - Attributname muss vollständig passen (" x=" trifft nicht "max=")
 * - fehlt das Attribut oder ist der Wert kaputt -> leeres Optional
 * - keine Exceptions als Kontrollfluss, der Aufrufer entscheidet "skip"
 */
public final class FieldDecoder {

    private FieldDecoder() {
    }

    /**
     * @param line      one raw trace line
     * @param attribute attribute name without '=' (e.g. "lane")
     * @return the raw attribute value, empty if absent, unterminated or blank
     */
    public static Optional<String> text(String line, String attribute) {
        int valueStart = valueStart(line, attribute);
        if (valueStart < 0) {
            return Optional.empty();
        }
        int valueEnd = line.indexOf('"', valueStart);
        if (valueEnd < 0 || valueEnd == valueStart) {
            return Optional.empty();
        }
        return Optional.of(line.substring(valueStart, valueEnd));
    }

    /**
     * @return the attribute parsed as a finite double, empty otherwise
     */
    public static OptionalDouble number(String line, String attribute) {
        Optional<String> raw = text(line, attribute);
        if (raw.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(raw.get());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(value);
        } catch (NumberFormatException ex) {
            return OptionalDouble.empty();
        }
    }

    // Index des ersten Zeichens nach name=" oder -1.
    // Davor muss Whitespace stehen, sonst ist es nur ein Suffix eines anderen Attributs.
    private static int valueStart(String line, String attribute) {
        String needle = attribute + "=\"";
        int from = 0;
        while (true) {
            int idx = line.indexOf(needle, from);
            if (idx < 0) {
                return -1;
            }
            if (idx > 0 && Character.isWhitespace(line.charAt(idx - 1))) {
                return idx + needle.length();
            }
            from = idx + 1;
        }
    }
}
