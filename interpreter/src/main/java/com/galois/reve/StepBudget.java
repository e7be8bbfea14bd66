package com.galois.reve;

/**
 * Counts block visits against a limit.  One budget is shared by every call of
 * a top-level interpretation.
 */
public final class StepBudget {
    private final int maxSteps;
    private int used;

    public StepBudget(int maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be non-negative: " + maxSteps);
        }
        this.maxSteps = maxSteps;
        this.used = 0;
    }

    /**
     * Take one block visit from the budget.
     * @return false if the budget is exhausted, in which case nothing is taken
     */
    public boolean tryConsume() {
        if (used >= maxSteps) {
            return false;
        }
        ++used;
        return true;
    }

    /** Number of block visits taken so far. */
    public int used() {
        return used;
    }

    public int remaining() {
        return maxSteps - used;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public String toString() {
        return used + "/" + maxSteps + " steps";
    }
}
