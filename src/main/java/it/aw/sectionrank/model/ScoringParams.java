package it.aw.sectionrank.model;

/**
 * Costanti euristiche della pipeline, raccolte in un'unica struttura immutabile.
 * <p>
 * I valori di default sono parametri di tuning, non costanti da considerare
 * esatte: vanno tarati empiricamente sulle collezioni di riferimento.
 *
 * @param weights                pesi w1..w5 del punteggio composito degli heading
 * @param largeFontRatio         soglia "font grande" rispetto al font del corpo della pagina
 * @param topZone                frazione superiore della pagina considerata "in cima"
 * @param leftZone               frazione sinistra della pagina considerata "allineata a sinistra"
 * @param minHeadingChars        lunghezza minima di un heading in caratteri
 * @param maxHeadingChars        lunghezza massima di un heading in caratteri
 * @param maxHeadingWords        numero massimo di parole di un heading
 * @param idealMaxWords          oltre questo numero di parole l'heading viene penalizzato
 * @param maxSections            K: numero massimo di sezioni estratte
 * @param subsectionsPerDocument blocchi rifiniti tenuti per documento
 * @param maxSubsections         estratti totali nell'output
 * @param minBlockChars          lunghezza minima di un blocco di contenuto
 * @param idealBlockChars        lunghezza oltre la quale un blocco non guadagna altro punteggio
 * @param minSentenceChars       lunghezza minima di una frase qualificante
 * @param maxRefinedLength       lunghezza massima del testo rifinito, ellissi inclusa
 * @param blockGapFactor         salto verticale (in multipli del font) che separa due blocchi
 * @param blockFontTolerance     differenza di font (pt) oltre la quale inizia un nuovo blocco
 * @param densityWeight          peso della densità di keyword nel punteggio dei blocchi
 * @param lengthWeight           peso della lunghezza nel punteggio dei blocchi
 */
public record ScoringParams(
        ScoreWeights weights,
        double largeFontRatio,
        double topZone,
        double leftZone,
        int    minHeadingChars,
        int    maxHeadingChars,
        int    maxHeadingWords,
        int    idealMaxWords,
        int    maxSections,
        int    subsectionsPerDocument,
        int    maxSubsections,
        int    minBlockChars,
        int    idealBlockChars,
        int    minSentenceChars,
        int    maxRefinedLength,
        double blockGapFactor,
        double blockFontTolerance,
        double densityWeight,
        double lengthWeight
) {

    public static final int    DEFAULT_MAX_SECTIONS            = 5;
    public static final int    DEFAULT_SUBSECTIONS_PER_DOCUMENT = 3;
    public static final int    DEFAULT_MAX_SUBSECTIONS         = 5;
    public static final int    DEFAULT_MAX_REFINED_LENGTH      = 500;
    public static final int    DEFAULT_MAX_HEADING_WORDS       = 12;
    public static final double DEFAULT_LARGE_FONT_RATIO        = 1.2;
    public static final double DEFAULT_TOP_ZONE                = 0.3;
    public static final double DEFAULT_LEFT_ZONE               = 0.2;

    /**
     * Pesi del punteggio composito: i segnali strutturali (font, grassetto,
     * posizione) dominano, la rilevanza per keyword fa da spareggio.
     */
    public record ScoreWeights(double fontSize, double bold, double position, double keyword, double length) {

        public static final double DEFAULT_FONT_SIZE = 3.0;
        public static final double DEFAULT_BOLD      = 2.0;
        public static final double DEFAULT_POSITION  = 2.0;
        public static final double DEFAULT_KEYWORD   = 1.5;
        public static final double DEFAULT_LENGTH    = 1.0;

        public ScoreWeights {
            if (fontSize < 0 || bold < 0 || position < 0 || keyword < 0 || length < 0) {
                throw new IllegalArgumentException("i pesi del punteggio devono essere >= 0");
            }
        }

        public static ScoreWeights defaults() {
            return new ScoreWeights(DEFAULT_FONT_SIZE, DEFAULT_BOLD, DEFAULT_POSITION,
                    DEFAULT_KEYWORD, DEFAULT_LENGTH);
        }
    }

    /** Costruttore compatto con validazione. */
    public ScoringParams {
        if (weights == null) {
            throw new IllegalArgumentException("weights obbligatorio");
        }
        if (maxSections < 1) {
            throw new IllegalArgumentException("maxSections deve essere >= 1 (ricevuto: " + maxSections + ")");
        }
        if (subsectionsPerDocument < 0 || maxSubsections < 0) {
            throw new IllegalArgumentException("i limiti sugli estratti devono essere >= 0");
        }
        if (maxRefinedLength < 20) {
            throw new IllegalArgumentException("maxRefinedLength deve essere >= 20 (ricevuto: " + maxRefinedLength + ")");
        }
        if (minHeadingChars < 1 || maxHeadingChars < minHeadingChars) {
            throw new IllegalArgumentException(
                    "intervallo caratteri heading non valido: [" + minHeadingChars + ", " + maxHeadingChars + "]");
        }
        if (maxHeadingWords < 1 || idealMaxWords < 1) {
            throw new IllegalArgumentException("i limiti di parole degli heading devono essere >= 1");
        }
        if (largeFontRatio <= 0 || topZone <= 0 || topZone > 1 || leftZone <= 0 || leftZone > 1) {
            throw new IllegalArgumentException("soglie di font/posizione fuori intervallo");
        }
        if (idealBlockChars < 1 || blockGapFactor <= 0 || blockFontTolerance < 0) {
            throw new IllegalArgumentException("parametri di raggruppamento blocchi non validi");
        }
    }

    public static ScoringParams defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .weights(weights)
                .largeFontRatio(largeFontRatio)
                .topZone(topZone)
                .leftZone(leftZone)
                .minHeadingChars(minHeadingChars)
                .maxHeadingChars(maxHeadingChars)
                .maxHeadingWords(maxHeadingWords)
                .idealMaxWords(idealMaxWords)
                .maxSections(maxSections)
                .subsectionsPerDocument(subsectionsPerDocument)
                .maxSubsections(maxSubsections)
                .minBlockChars(minBlockChars)
                .idealBlockChars(idealBlockChars)
                .minSentenceChars(minSentenceChars)
                .maxRefinedLength(maxRefinedLength)
                .blockGapFactor(blockGapFactor)
                .blockFontTolerance(blockFontTolerance)
                .densityWeight(densityWeight)
                .lengthWeight(lengthWeight);
    }

    public static final class Builder {
        private ScoreWeights weights       = ScoreWeights.defaults();
        private double largeFontRatio      = DEFAULT_LARGE_FONT_RATIO;
        private double topZone             = DEFAULT_TOP_ZONE;
        private double leftZone            = DEFAULT_LEFT_ZONE;
        private int    minHeadingChars     = 3;
        private int    maxHeadingChars     = 120;
        private int    maxHeadingWords     = DEFAULT_MAX_HEADING_WORDS;
        private int    idealMaxWords       = 8;
        private int    maxSections         = DEFAULT_MAX_SECTIONS;
        private int    subsectionsPerDocument = DEFAULT_SUBSECTIONS_PER_DOCUMENT;
        private int    maxSubsections      = DEFAULT_MAX_SUBSECTIONS;
        private int    minBlockChars       = 30;
        private int    idealBlockChars     = 600;
        private int    minSentenceChars    = 20;
        private int    maxRefinedLength    = DEFAULT_MAX_REFINED_LENGTH;
        private double blockGapFactor      = 2.0;
        private double blockFontTolerance  = 1.5;
        private double densityWeight       = 4.0;
        private double lengthWeight        = 1.0;

        private Builder() {}

        public Builder weights(ScoreWeights v)           { this.weights = v; return this; }
        public Builder largeFontRatio(double v)          { this.largeFontRatio = v; return this; }
        public Builder topZone(double v)                 { this.topZone = v; return this; }
        public Builder leftZone(double v)                { this.leftZone = v; return this; }
        public Builder minHeadingChars(int v)            { this.minHeadingChars = v; return this; }
        public Builder maxHeadingChars(int v)            { this.maxHeadingChars = v; return this; }
        public Builder maxHeadingWords(int v)            { this.maxHeadingWords = v; return this; }
        public Builder idealMaxWords(int v)              { this.idealMaxWords = v; return this; }
        public Builder maxSections(int v)                { this.maxSections = v; return this; }
        public Builder subsectionsPerDocument(int v)     { this.subsectionsPerDocument = v; return this; }
        public Builder maxSubsections(int v)             { this.maxSubsections = v; return this; }
        public Builder minBlockChars(int v)              { this.minBlockChars = v; return this; }
        public Builder idealBlockChars(int v)            { this.idealBlockChars = v; return this; }
        public Builder minSentenceChars(int v)           { this.minSentenceChars = v; return this; }
        public Builder maxRefinedLength(int v)           { this.maxRefinedLength = v; return this; }
        public Builder blockGapFactor(double v)          { this.blockGapFactor = v; return this; }
        public Builder blockFontTolerance(double v)      { this.blockFontTolerance = v; return this; }
        public Builder densityWeight(double v)           { this.densityWeight = v; return this; }
        public Builder lengthWeight(double v)            { this.lengthWeight = v; return this; }

        public ScoringParams build() {
            return new ScoringParams(weights, largeFontRatio, topZone, leftZone,
                    minHeadingChars, maxHeadingChars, maxHeadingWords, idealMaxWords,
                    maxSections, subsectionsPerDocument, maxSubsections,
                    minBlockChars, idealBlockChars, minSentenceChars, maxRefinedLength,
                    blockGapFactor, blockFontTolerance, densityWeight, lengthWeight);
        }
    }
}
