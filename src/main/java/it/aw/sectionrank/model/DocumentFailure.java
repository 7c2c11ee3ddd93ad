package it.aw.sectionrank.model;

/**
 * Documento scartato durante l'elaborazione, con il motivo.
 */
public record DocumentFailure(String document, String reason) {}
