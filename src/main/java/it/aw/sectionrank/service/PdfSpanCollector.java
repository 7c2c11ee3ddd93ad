package it.aw.sectionrank.service;

import it.aw.sectionrank.exception.DocumentReadException;
import it.aw.sectionrank.model.Document;
import it.aw.sectionrank.model.PageRecord;
import it.aw.sectionrank.model.SpanPosition;
import it.aw.sectionrank.model.TextSpan;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Converte un PDF in span di testo con metadati di font e posizione, via PDFBox.
 * <p>
 * Uno span è una sequenza di caratteri sulla stessa riga con lo stesso font,
 * la stessa dimensione e lo stesso peso. Gli span vengono emessi nell'ordine
 * di lettura riportato da {@link PDFTextStripper}: nessun riordino né
 * deduplicazione.
 */
public class PdfSpanCollector {

    private static final Logger log = LoggerFactory.getLogger(PdfSpanCollector.class);

    private static final String[] BOLD_NAME_MARKERS = {"bold", "black", "heavy", "semibold", "demi"};
    private static final float BOLD_FONT_WEIGHT = 600f;

    private PdfSpanCollector() {}

    /**
     * Legge il PDF dal path indicato.
     *
     * @param path     file PDF
     * @param filename nome con cui il documento compare nell'output
     * @throws DocumentReadException se il file manca o non è un PDF leggibile
     */
    public static Document collect(Path path, String filename) {
        if (!Files.isRegularFile(path)) {
            throw new DocumentReadException(filename, "File PDF non trovato: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return collect(filename, is);
        } catch (IOException e) {
            throw new DocumentReadException(filename, "Impossibile aprire " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Esegue il parsing del PDF dall'input stream.
     * L'input stream NON viene chiuso dal metodo: la responsabilità è del chiamante.
     *
     * @throws DocumentReadException se il PDF è corrotto, cifrato senza permesso
     *                               di estrazione o senza pagine
     */
    public static Document collect(String filename, InputStream inputStream) {
        try (PDDocument doc = PDDocument.load(inputStream)) {
            int totalPages = doc.getNumberOfPages();
            if (totalPages == 0) {
                throw new DocumentReadException(filename, "Il documento non contiene pagine");
            }
            if (!doc.getCurrentAccessPermission().canExtractContent()) {
                throw new DocumentReadException(filename, "Documento cifrato: estrazione del testo non consentita");
            }
            log.debug("PdfSpanCollector: {} — {} pagine trovate", filename, totalPages);

            SpanStripper stripper = new SpanStripper();
            stripper.getText(doc);

            String title = doc.getDocumentInformation() != null
                    ? doc.getDocumentInformation().getTitle()
                    : null;
            Document document = new Document(filename, title, allPages(stripper.pages, totalPages));
            log.debug("PdfSpanCollector: {} — {} span estratti",
                    filename, document.spans().count());
            return document;
        } catch (IOException e) {
            throw new DocumentReadException(filename, "PDF non leggibile: " + e.getMessage(), e);
        }
    }

    /**
     * Una PageRecord per ogni pagina 1..totalPages: PDFTextStripper salta le
     * pagine senza content stream, che diventano pagine vuote.
     */
    private static List<PageRecord> allPages(List<PageRecord> extracted, int totalPages) {
        Map<Integer, PageRecord> byNumber = new HashMap<>();
        for (PageRecord page : extracted) byNumber.put(page.pageNumber(), page);
        List<PageRecord> pages = new ArrayList<>(totalPages);
        for (int n = 1; n <= totalPages; n++) {
            pages.add(byNumber.getOrDefault(n, new PageRecord(n, List.of())));
        }
        return pages;
    }

    /** True se il font è in grassetto secondo il nome o il descrittore. */
    static boolean isBold(PDFont font) {
        if (font == null) return false;
        String name = font.getName();
        if (name != null) {
            String lower = name.toLowerCase(Locale.ROOT);
            for (String marker : BOLD_NAME_MARKERS) {
                if (lower.contains(marker)) return true;
            }
        }
        PDFontDescriptor descriptor = font.getFontDescriptor();
        return descriptor != null
                && (descriptor.isForceBold() || descriptor.getFontWeight() >= BOLD_FONT_WEIGHT);
    }

    /**
     * Stripper che, invece di scrivere testo, accumula span pagina per pagina.
     * PDFBox chiama writeString parola per parola, writeWordSeparator tra le
     * parole e writeLineSeparator a fine riga.
     */
    private static final class SpanStripper extends PDFTextStripper {

        private final List<PageRecord> pages = new ArrayList<>();
        private List<TextSpan> pageSpans;
        private float pageWidth;
        private float pageHeight;

        private final StringBuilder runText = new StringBuilder();
        private TextPosition runStart;
        private String runFont;
        private float runSize;
        private boolean runBold;
        private boolean pendingSeparator;

        SpanStripper() throws IOException {
            super();
        }

        @Override
        protected void startPage(PDPage page) throws IOException {
            super.startPage(page);
            PDRectangle box = page.getCropBox();
            pageWidth = box.getWidth();
            pageHeight = box.getHeight();
            pageSpans = new ArrayList<>();
            resetRun();
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) {
            for (TextPosition tp : textPositions) {
                String unicode = tp.getUnicode();
                if (unicode == null || unicode.isEmpty()) continue;

                PDFont font = tp.getFont();
                String fontName = font != null ? font.getName() : null;
                float size = tp.getFontSizeInPt();
                boolean bold = isBold(font);

                boolean sameStyle = Objects.equals(fontName, runFont)
                        && Float.compare(size, runSize) == 0
                        && bold == runBold;
                if (runText.length() > 0 && !sameStyle) {
                    flushRun();
                }
                if (runText.length() == 0) {
                    runStart = tp;
                    runFont = fontName;
                    runSize = size;
                    runBold = bold;
                } else if (pendingSeparator) {
                    runText.append(' ');
                }
                pendingSeparator = false;
                runText.append(unicode);
            }
        }

        @Override
        protected void writeWordSeparator() {
            pendingSeparator = true;
        }

        @Override
        protected void writeLineSeparator() {
            flushRun();
        }

        @Override
        protected void endPage(PDPage page) throws IOException {
            flushRun();
            pages.add(new PageRecord(getCurrentPageNo(), pageSpans));
            super.endPage(page);
        }

        private void flushRun() {
            String text = runText.toString().trim();
            if (!text.isEmpty() && runStart != null) {
                float top = runStart.getYDirAdj() - runStart.getHeightDir();
                SpanPosition position = new SpanPosition(
                        runStart.getXDirAdj(), Math.max(0f, top), pageWidth, pageHeight);
                pageSpans.add(new TextSpan(text, runSize, runBold, position, getCurrentPageNo()));
            }
            resetRun();
        }

        private void resetRun() {
            runText.setLength(0);
            runStart = null;
            runFont = null;
            runSize = 0f;
            runBold = false;
            pendingSeparator = false;
        }
    }
}
