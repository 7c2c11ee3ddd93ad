package it.aw.sectionrank.service;

import it.aw.sectionrank.model.Document;
import it.aw.sectionrank.model.DocumentOutline;
import it.aw.sectionrank.model.OutlineEntry;
import it.aw.sectionrank.model.PageRecord;
import it.aw.sectionrank.model.SpanPosition;
import it.aw.sectionrank.model.TextSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("OutlineExtractor")
class OutlineExtractorTest {

    private final OutlineExtractor extractor = new OutlineExtractor();

    private static TextSpan span(String text, float size, boolean bold, float y, int page) {
        return new TextSpan(text, size, bold, new SpanPosition(72f, y, 595f, 842f), page);
    }

    private static List<TextSpan> body(float fromY, int page, int count) {
        List<TextSpan> lines = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            lines.add(span("Ordinary body text that fills the page line " + i, 10f, false, fromY + i * 12f, page));
        }
        return lines;
    }

    private static Document guide(String infoTitle) {
        List<TextSpan> first = new ArrayList<>();
        first.add(span("Annual Travel Guide", 20f, true, 60f, 1));
        first.add(span("Overview", 20f, true, 200f, 1));
        first.addAll(body(230f, 1, 20));
        first.add(span("Getting There", 16f, true, 500f, 1));

        List<TextSpan> second = new ArrayList<>();
        second.add(span("Overview", 20f, true, 80f, 2));
        second.add(span("Where to Stay", 16f, true, 110f, 2));
        second.addAll(body(140f, 2, 20));
        return new Document("annual_travel-guide.pdf", infoTitle,
                List.of(new PageRecord(1, first), new PageRecord(2, second)));
    }

    @Test
    @DisplayName("assegna i livelli per dimensione e scarta i duplicati")
    void shouldBuildOutlineWithLevels_andDropDuplicates() {
        DocumentOutline outline = extractor.extract(guide(null));

        assertThat(outline.title()).isEqualTo("Annual Travel Guide");
        assertThat(outline.outline())
                .extracting(OutlineEntry::level, OutlineEntry::text, OutlineEntry::page)
                .containsExactly(
                        tuple("H1", "Overview", 1),
                        tuple("H2", "Getting There", 1),
                        tuple("H2", "Where to Stay", 2));
    }

    @Test
    @DisplayName("preferisce il titolo del dizionario Info")
    void shouldPreferInfoTitle() {
        assertThat(extractor.extract(guide("Riviera Handbook")).title()).isEqualTo("Riviera Handbook");
    }

    @Test
    @DisplayName("senza testo usa il nome del file come titolo")
    void shouldFallBackToFilename_whenDocumentHasNoText() {
        Document empty = new Document("south_of-france.pdf", null, List.of(new PageRecord(1, List.of())));

        DocumentOutline outline = extractor.extract(empty);

        assertThat(outline.title()).isEqualTo("South Of France");
        assertThat(outline.outline()).isEmpty();
    }

    @Test
    @DisplayName("le dimensioni significative sono al più tre, dalla più grande")
    void shouldSelectSignificantSizes() {
        List<TextSpan> spans = new ArrayList<>(body(100f, 1, 40));
        for (float size : new float[]{28f, 24f, 20f, 16f}) {
            spans.add(span("Heading A", size, true, 50f, 1));
            spans.add(span("Heading B", size, true, 60f, 1));
        }
        spans.add(span("Unique Size", 30f, true, 40f, 1));

        assertThat(OutlineExtractor.significantSizes(spans)).containsExactly(28f, 24f, 20f);
    }

    @Test
    @DisplayName("il livello è quello della dimensione significativa più vicina")
    void shouldMapSizeToNearestLevel() {
        List<Float> significant = List.of(24f, 18f, 14f);

        assertThat(OutlineExtractor.levelOf(24f, significant)).isEqualTo("H1");
        assertThat(OutlineExtractor.levelOf(17f, significant)).isEqualTo("H2");
        assertThat(OutlineExtractor.levelOf(12f, significant)).isEqualTo("H3");
        assertThat(OutlineExtractor.levelOf(12f, List.of())).isEqualTo("H3");
    }
}
