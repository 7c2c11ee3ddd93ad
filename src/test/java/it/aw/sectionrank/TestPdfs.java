package it.aw.sectionrank;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Genera PDF di test con PDFBox: ogni riga ha testo, font, dimensione e posizione
 * espressa dall'alto della pagina (A4).
 */
public final class TestPdfs {

    public static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;
    public static final PDFont REGULAR = PDType1Font.HELVETICA;
    public static final float LEFT_MARGIN = 72f;

    private TestPdfs() {}

    public record Line(String text, PDFont font, float size, float x, float yFromTop) {}

    public static Line heading(String text, float yFromTop) {
        return new Line(text, BOLD, 24f, LEFT_MARGIN, yFromTop);
    }

    public static Line body(String text, float yFromTop) {
        return new Line(text, REGULAR, 11f, LEFT_MARGIN, yFromTop);
    }

    /** Righe di corpo consecutive a interlinea 14 pt a partire da yFromTop. */
    public static List<Line> paragraph(float yFromTop, String... lines) {
        List<Line> result = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            result.add(body(lines[i], yFromTop + i * 14f));
        }
        return result;
    }

    @SafeVarargs
    public static List<Line> page(List<Line>... parts) {
        List<Line> result = new ArrayList<>();
        for (List<Line> part : parts) result.addAll(part);
        return result;
    }

    public static byte[] build(List<List<Line>> pages) throws IOException {
        return build(null, pages);
    }

    public static byte[] build(String infoTitle, List<List<Line>> pages) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            if (infoTitle != null) {
                doc.getDocumentInformation().setTitle(infoTitle);
            }
            for (List<Line> lines : pages) {
                PDPage page = new PDPage(PDRectangle.A4);
                doc.addPage(page);
                if (lines.isEmpty()) continue; // pagina senza content stream
                float height = page.getMediaBox().getHeight();
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    for (Line line : lines) {
                        cs.beginText();
                        cs.setFont(line.font(), line.size());
                        cs.newLineAtOffset(line.x(), height - line.yFromTop());
                        cs.showText(line.text());
                        cs.endText();
                    }
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    /** PDF cifrato apribile senza password, ma con estrazione del testo vietata. */
    public static byte[] buildWithoutExtractPermission(List<List<Line>> pages) throws IOException {
        try (PDDocument doc = PDDocument.load(build(pages))) {
            AccessPermission permission = new AccessPermission();
            permission.setCanExtractContent(false);
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner-secret", "", permission);
            policy.setEncryptionKeyLength(128);
            doc.protect(policy);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    public static Path write(Path dir, String filename, List<List<Line>> pages) throws IOException {
        Files.createDirectories(dir);
        return Files.write(dir.resolve(filename), build(pages));
    }

    public static Path writeCorrupt(Path dir, String filename) throws IOException {
        Files.createDirectories(dir);
        return Files.write(dir.resolve(filename), "%PDF-1.4\nquesto non e' un pdf".getBytes());
    }
}
