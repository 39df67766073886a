package rt.congestion.application.validation;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidationReportTest {

    private final ValidationReport report = new ValidationReport(List.of(
            CorridorResult.measured("Calea Iesilor - Centru", 8.6, 12.9, 14),
            CorridorResult.noData("Ciocana - Centru", 9.7)));

    @TempDir
    Path dir;

    @Test
    void printsTable() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        report.printTable(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        String out = buffer.toString(StandardCharsets.UTF_8);

        assertTrue(out.contains("Calea Iesilor - Centru"));
        assertTrue(out.contains("1.5x"));
        assertTrue(out.contains("needs tuning"));
        assertTrue(out.contains("N/A"));
        assertTrue(out.contains("no data"));
    }

    @Test
    void exportsCsv() throws IOException {
        Path csv = dir.resolve("validation_report.csv");

        report.exportToCsv(csv);

        List<String> lines = Files.readAllLines(csv);
        assertEquals("name;reference_speed;simulated_speed;ratio;verdict;matched_edges", lines.get(0));
        assertEquals("Calea Iesilor - Centru;8.60;12.90;1.500;NEEDS_TUNING;14", lines.get(1));
        assertEquals("Ciocana - Centru;9.70;;;NO_DATA;0", lines.get(2));
    }

    @Test
    void exportsPdf() throws IOException {
        Path pdf = dir.resolve("reports/validation_report.pdf");

        report.exportToPdf(pdf);

        try (PDDocument doc = Loader.loadPDF(pdf.toFile())) {
            assertEquals(1, doc.getNumberOfPages());
            String text = new PDFTextStripper().getText(doc);
            assertTrue(text.contains("Validation Report"));
            assertTrue(text.contains("Ciocana - Centru"));
        }
    }

    @Test
    void pdfTextIsWinAnsiSafe() {
        assertEquals("Stefan cel Mare ? Centru", ValidationReport.pdfSafe("Ştefan cel Mare – Centru"));
    }
}
