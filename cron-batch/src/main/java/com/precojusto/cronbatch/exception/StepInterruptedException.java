package com.precojusto.cronbatch.exception;

/**
 * Thrown when the time budget runs out between sub-units of a step. Not an error:
 * the step stays incomplete and the next invocation resumes it.
 */
public class StepInterruptedException extends RuntimeException {

    private final int completedUnits;
    private final int totalUnits;

    public StepInterruptedException(String step, int completedUnits, int totalUnits) {
        super("Step " + step + " interrupted after " + completedUnits + "/" + totalUnits + " sub-units");
        this.completedUnits = completedUnits;
        this.totalUnits = totalUnits;
    }

    public int getCompletedUnits() {
        return completedUnits;
    }

    public int getTotalUnits() {
        return totalUnits;
    }
}
