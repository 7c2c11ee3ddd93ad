package it.aw.sectionrank.model;

/**
 * Voce dell'outline di un documento: livello ("H1".."H3"), testo, pagina.
 */
public record OutlineEntry(String level, String text, int page) {}
