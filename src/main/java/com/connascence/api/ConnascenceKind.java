package com.connascence.api;

/**
 * Kinds of connascence, weighted from weakest to strongest coupling.
 */
public enum ConnascenceKind implements ViolationKind {
    NAME("CoN", 1),
    TYPE("CoT", 2),
    MEANING("CoM", 3),
    POSITION("CoP", 4),
    ALGORITHM("CoA", 5),
    EXECUTION("CoE", 6),
    VALUE("CoV", 7),
    TIMING("CoTi", 8),
    IDENTITY("CoI", 9);

    private final String abbreviation;
    private final int weight;

    ConnascenceKind(String abbreviation, int weight) {
        this.abbreviation = abbreviation;
        this.weight = weight;
    }

    @Override
    public String code() {
        return abbreviation;
    }

    @Override
    public int getWeight() {
        return weight;
    }

    public String getDescription() {
        return switch (this) {
            case NAME -> "Connascence of Name";
            case TYPE -> "Connascence of Type";
            case MEANING -> "Connascence of Meaning";
            case POSITION -> "Connascence of Position";
            case ALGORITHM -> "Connascence of Algorithm";
            case EXECUTION -> "Connascence of Execution";
            case VALUE -> "Connascence of Value";
            case TIMING -> "Connascence of Timing";
            case IDENTITY -> "Connascence of Identity";
        };
    }
}
