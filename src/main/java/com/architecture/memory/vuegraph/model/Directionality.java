package com.architecture.memory.vuegraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Directionality {
    DIRECTED("directed"),
    UNDIRECTED("undirected"),
    BIDIRECTIONAL("bidirectional");

    /** Arrow drawn on the first endpoint only: the link points from ID2 to ID1. */
    public static final int REVERSED_ARROW_STATE = 1;

    private static final int NO_ARROW_STATE = 0;
    private static final int BOTH_ARROWS_STATE = 3;

    private final String value;

    Directionality(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Directionality fromArrowState(int arrowState) {
        if (arrowState == BOTH_ARROWS_STATE) return BIDIRECTIONAL;
        if (arrowState == NO_ARROW_STATE) return UNDIRECTED;
        return DIRECTED;
    }

    public static boolean isReversed(int arrowState) {
        return arrowState == REVERSED_ARROW_STATE;
    }
}
