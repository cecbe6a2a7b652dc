package com.paircraft.engine.pairing;

/**
 * Hard cap on backtracking work: an iteration count and a wall-clock deadline, whichever
 * comes first. Not thread-safe; each generation call gets its own budget.
 */
public final class SearchBudget {

    private final long maxIterations;
    private final long timeBudgetNanos;
    private final long deadline;
    private long used;
    private boolean exhausted;

    public SearchBudget(long maxIterations, long timeBudgetMillis) {
        this.maxIterations = maxIterations;
        this.timeBudgetNanos = timeBudgetMillis * 1_000_000L;
        this.deadline = System.nanoTime() + timeBudgetNanos;
    }

    /**
     * Accounts for one step of search.
     *
     * @return false once the budget is spent
     */
    public boolean tick() {
        if (exhausted) {
            return false;
        }
        used++;
        // The clock is only read every 1024 steps.
        if (used > maxIterations || ((used & 1023) == 0 && System.nanoTime() > deadline)) {
            exhausted = true;
            return false;
        }
        return true;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public long used() {
        return used;
    }

    /**
     * A fresh budget of the same size, used for the relaxed fallback pass.
     */
    public SearchBudget renewed() {
        return new SearchBudget(maxIterations, timeBudgetNanos / 1_000_000L);
    }
}
