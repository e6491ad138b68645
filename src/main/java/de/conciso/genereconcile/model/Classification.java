package de.conciso.genereconcile.model;

public record Classification(Category category, int evidenceScore) {}
