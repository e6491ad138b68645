package de.conciso.genereconcile.model;

public enum MappingDirection {
    HUMAN_TO_MOUSE("human_to_mouse", Organism.HUMAN),
    MOUSE_TO_HUMAN("mouse_to_human", Organism.MOUSE);

    private final String label;
    private final Organism source;

    MappingDirection(String label, Organism source) {
        this.label = label;
        this.source = source;
    }

    public String label() {
        return label;
    }

    public Organism source() {
        return source;
    }

    public Organism target() {
        return source.other();
    }

    public static MappingDirection parse(String label) {
        for (MappingDirection d : values()) {
            if (d.label.equalsIgnoreCase(label.trim())) return d;
        }
        throw new IllegalArgumentException("Unknown mapping source: " + label);
    }
}
