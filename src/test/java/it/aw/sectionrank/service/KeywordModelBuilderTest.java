package it.aw.sectionrank.service;

import it.aw.sectionrank.model.KeywordModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KeywordModelBuilder")
class KeywordModelBuilderTest {

    private final KeywordModelBuilder builder = new KeywordModelBuilder();

    @Test
    @DisplayName("estrae termini scartando stop-word, token corti e numeri")
    void shouldExtractTerms_withoutStopWordsShortTokensAndNumbers() {
        KeywordModel model = builder.build("PhD Researcher in Biology",
                "Prepare a literature review on methodologies for 4 papers");

        assertThat(model.terms()).containsKeys("researcher", "biology", "literature", "review", "methodologies", "papers");
        assertThat(model.terms()).doesNotContainKeys("in", "a", "on", "for", "4");
    }

    @Test
    @DisplayName("pesa di più i termini lunghi e ripetuti, dimezza i generici")
    void shouldWeightLongRepeatedTerms_andHalveGenericOnes() {
        KeywordModel model = builder.build("Travel Planner", "Plan a trip for travel with friends");

        // travel: 2 occorrenze × 6 caratteri
        assertThat(model.terms().get("travel")).isEqualTo(12.0);
        // trip: 1 × 4
        assertThat(model.terms().get("trip")).isEqualTo(4.0);
        // plan è generico: 1 × 4 × 0.5
        assertThat(model.terms().get("plan")).isEqualTo(2.0);
        assertThat(model.maxWeight()).isEqualTo(12.0);
    }

    @Test
    @DisplayName("i pattern riconoscono plurali e derivati, senza distinzione di maiuscole")
    void shouldMatchPluralsAndDerivatives_caseInsensitively() {
        KeywordModel model = builder.build("", "methodologies");

        assertThat(model.matchesAny("Methodology")).isTrue();
        assertThat(model.matchesAny("the METHODOLOGICAL approach")).isTrue();
        assertThat(model.matchesAny("Results and Discussion")).isFalse();
    }

    @Test
    @DisplayName("persona e job vuoti producono un modello solo strutturale")
    void shouldReturnStructuralOnlyModel_whenInputsAreEmpty() {
        KeywordModel model = builder.build("", "   ");

        assertThat(model.isEmpty()).isTrue();
        assertThat(model.matchScore("Methodology")).isZero();
        assertThat(model.matchesAny("anything at all")).isFalse();
        assertThat(model.headingPatterns()).isNotEmpty();
    }

    @Test
    @DisplayName("input null trattati come vuoti")
    void shouldTreatNullInputsAsEmpty() {
        assertThat(builder.build(null, null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("stessi input, stesso modello")
    void shouldBeDeterministic() {
        KeywordModel first = builder.build("HR professional", "Create and manage fillable forms for onboarding");
        KeywordModel second = builder.build("HR professional", "Create and manage fillable forms for onboarding");

        assertThat(first.terms()).containsExactlyEntriesOf(second.terms());
        assertThat(first.termPatterns().keySet()).containsExactlyElementsOf(second.termPatterns().keySet());
    }

    @Test
    @DisplayName("matchScore è normalizzato in [0, 1]")
    void shouldNormalizeMatchScore() {
        KeywordModel model = builder.build("Food Contractor", "vegetarian buffet menu dinner");

        assertThat(model.matchScore("Vegetarian Buffet Menu Dinner Food")).isEqualTo(1.0);
        assertThat(model.matchScore("Vegetarian Sides")).isBetween(0.0, 1.0).isPositive();
        assertThat(model.matchScore("Breakfast Ideas")).isZero();
    }

    @Test
    @DisplayName("riconosce le forme tipiche dei titoli")
    void shouldRecognizeHeadingShapes() {
        KeywordModel model = builder.build("", "");

        assertThat(model.looksLikeHeading("2.1 Data Collection")).isTrue();
        assertThat(model.looksLikeHeading("Chapter 3 Results")).isTrue();
        assertThat(model.looksLikeHeading("Methodology")).isTrue();
        assertThat(model.looksLikeHeading("INTRODUCTION")).isTrue();
        assertThat(model.looksLikeHeading("this is a lowercase line")).isFalse();
    }

    @Test
    @DisplayName("stem toglie il suffisso solo se resta una radice sufficiente")
    void shouldStemOnlyWhenRootIsLongEnough() {
        assertThat(KeywordModelBuilder.stem("cities")).isEqualTo("citi");
        assertThat(KeywordModelBuilder.stem("planning")).isEqualTo("plann");
        assertThat(KeywordModelBuilder.stem("papers")).isEqualTo("paper");
        assertThat(KeywordModelBuilder.stem("uses")).isEqualTo("uses");
    }
}
