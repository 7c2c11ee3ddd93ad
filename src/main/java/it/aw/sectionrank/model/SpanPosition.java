package it.aw.sectionrank.model;

/**
 * Posizione di uno span nella pagina, in punti PDF.
 * <p>
 * {@code y} è il bordo superiore del testo misurato dall'alto della pagina,
 * quindi valori piccoli indicano testo in cima alla pagina.
 */
public record SpanPosition(float x, float y, float pageWidth, float pageHeight) {

    /** Ascissa relativa alla larghezza della pagina (0 = margine sinistro). */
    public double relativeX() {
        return pageWidth > 0 ? x / pageWidth : 0.0;
    }

    /** Ordinata relativa all'altezza della pagina (0 = bordo superiore). */
    public double relativeY() {
        return pageHeight > 0 ? y / pageHeight : 0.0;
    }
}
