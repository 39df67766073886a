// Validierungs-Report der Referenz-Korridore
/**ValidationReport:
 * - Hält pro Korridor: Name, Referenz, simuliert, Ratio, Verdict
 * - Ausgabe als Tabelle auf der Konsole
 * - Export als CSV und PDF
 *
 * Idee:
 * Der Report ist Daten, nicht nur Text. Tests und nachgelagerte Tools lesen getResults(),
 * die Exporte sind nur Darstellungen davon.
 */
package rt.congestion.application.validation;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ValidationReport {

	private static final Logger LOG = LoggerFactory.getLogger(ValidationReport.class);

	private final List<CorridorResult> results;

	/**
	 * @param results one result per configured corridor, in config order
	 */
	public ValidationReport(List<CorridorResult> results) {
		this.results = Collections.unmodifiableList(results);
	}

	public List<CorridorResult> getResults() {
		return results;
	}

	/**
	 * @param name corridor name
	 * @return the result or null if no corridor has this name
	 */
	public CorridorResult get(String name) {
		for (CorridorResult r : results) {
			if (r.name.equals(name)) {
				return r;
			}
		}
		return null;
	}

	/**
	 * @return amount of corridors with the given verdict
	 */
	public int count(Verdict verdict) {
		int n = 0;
		for (CorridorResult r : results) {
			if (r.verdict == verdict) {
				n++;
			}
		}
		return n;
	}

	// Tabelle wie im Konsolen-Menü
	public void printTable(PrintStream out) {
		out.println();
		out.println(String.format(Locale.ROOT, "  %-30s %8s %8s %7s  %s", "Corridor", "Ref", "Sim", "Ratio", "Status"));
		out.println(String.format(Locale.ROOT, "  %-30s %8s %8s %7s  %s", "-".repeat(30), "-".repeat(8), "-".repeat(8),
				"-".repeat(7), "-".repeat(20)));
		for (CorridorResult r : results) {
			out.println("  " + line(r));
		}
		out.println();
	}

	private static String line(CorridorResult r) {
		if (!r.hasData()) {
			return String.format(Locale.ROOT, "%-30s %8.1f %8s %7s  %s", r.name, r.referenceSpeedKmh, "N/A", "?",
					r.verdict.label());
		}
		return String.format(Locale.ROOT, "%-30s %8.1f %8.1f %6.1fx  %s", r.name, r.referenceSpeedKmh,
				r.simulatedSpeedKmh.getAsDouble(), r.ratio.getAsDouble(), r.verdict.label());
	}

	public void exportToCsv(Path path) throws IOException {
		// Ordner sicherstellen
		if (path.getParent() != null) {
			Files.createDirectories(path.getParent());
		}

		try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(path))) {
			String sep = ";";

			writer.println("name" + sep + "reference_speed" + sep + "simulated_speed" + sep + "ratio" + sep
					+ "verdict" + sep + "matched_edges");

			for (CorridorResult r : results) {
				String sim = r.simulatedSpeedKmh.isPresent()
						? String.format(Locale.ROOT, "%.2f", r.simulatedSpeedKmh.getAsDouble())
						: "";
				String ratio = r.ratio.isPresent() ? String.format(Locale.ROOT, "%.3f", r.ratio.getAsDouble()) : "";

				writer.println(r.name + sep
						+ String.format(Locale.ROOT, "%.2f", r.referenceSpeedKmh) + sep
						+ sim + sep
						+ ratio + sep
						+ r.verdict.name() + sep
						+ r.matchedEdges);
			}
		}

		LOG.info("[VALID] CSV exportiert nach: {}", path.toAbsolutePath());
	}

	public void exportToPdf(Path path) throws IOException {
		if (path.getParent() != null) {
			Files.createDirectories(path.getParent());
		}

		try (PDDocument document = new PDDocument()) {
			PDPage page = new PDPage();
			document.addPage(page);

			try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {

				contentStream.beginText();
				contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD), 16);
				contentStream.newLineAtOffset(50, 750);
				contentStream.showText("Validation Report - Peak Speeds vs Reference");

				contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 11);

				newLine(contentStream, 0, -30, String.format(Locale.ROOT,
						"Corridors: %d | good: %d | needs tuning: %d | under-congested: %d | no data: %d",
						results.size(), count(Verdict.GOOD), count(Verdict.NEEDS_TUNING),
						count(Verdict.UNDER_CONGESTED), count(Verdict.NO_DATA)));

				newLine(contentStream, 0, -25, "Per corridor (reference / simulated km/h, ratio, verdict):");

				if (results.isEmpty()) {
					newLine(contentStream, 0, -15, "No corridors configured.");
				} else {
					for (CorridorResult r : results) {
						newLine(contentStream, 0, -15, "- " + line(r).trim());
					}
				}

				contentStream.endText();
			}

			document.save(path.toFile());
		}

		LOG.info("[VALID] PDF exportiert nach: {}", path.toAbsolutePath());
	}

	// Newline methode, Standard-14 Fonts können nur WinAnsi
	private void newLine(PDPageContentStream cs, float dx, float dy, String text) throws IOException {
		cs.newLineAtOffset(dx, dy);
		cs.showText(pdfSafe(text));
	}

	static String pdfSafe(String text) {
		String stripped = Normalizer.normalize(text, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
		StringBuilder sb = new StringBuilder(stripped.length());
		for (int i = 0; i < stripped.length(); i++) {
			char c = stripped.charAt(i);
			sb.append(c >= 32 && c < 127 ? c : '?');
		}
		return sb.toString();
	}
}
