package com.kickahead.engine;

/**
 * Counts of what one successful {@link Dispatcher#tick()} did.
 * A tick that throws produces no result.
 */
public final class TickResult {
    private final int executed;
    private final int ignored;
    private final int hooked;

    public TickResult(int executed, int ignored, int hooked) {
        this.executed = executed;
        this.ignored = ignored;
        this.hooked = hooked;
    }

    /** Jobs performed on time and deleted. */
    public int getExecuted() {
        return executed;
    }

    /** Stale jobs dropped under the ignore strategy. */
    public int getIgnored() {
        return ignored;
    }

    /** Stale jobs handed to their out-of-time hook and deleted. */
    public int getHooked() {
        return hooked;
    }

    public int getTotal() {
        return executed + ignored + hooked;
    }

    @Override
    public String toString() {
        return "TickResult{" +
                "executed=" + executed +
                ", ignored=" + ignored +
                ", hooked=" + hooked +
                '}';
    }
}
