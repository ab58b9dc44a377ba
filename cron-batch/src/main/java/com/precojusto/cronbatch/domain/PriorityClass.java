package com.precojusto.cronbatch.domain;

/**
 * Priority class of a work item. Lower rank is selected first.
 */
public enum PriorityClass {
    PREMIUM(0),
    STANDARD(1),
    BACKGROUND(2);

    private final int rank;

    PriorityClass(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
