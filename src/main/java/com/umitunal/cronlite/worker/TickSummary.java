package com.umitunal.cronlite.worker;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts from one trigger cycle.
 */
public class TickSummary {
    private final int checked;
    private final int claimed;
    private final int succeeded;
    private final int failed;

    public TickSummary(int checked, int claimed, int succeeded, int failed) {
        this.checked = checked;
        this.claimed = claimed;
        this.succeeded = succeeded;
        this.failed = failed;
    }

    public static TickSummary empty() {
        return new TickSummary(0, 0, 0, 0);
    }

    /** Due jobs looked at. */
    @JsonProperty("checked")
    public int getChecked() { return checked; }

    /** Jobs this cycle won a lease for. */
    @JsonProperty("claimed")
    public int getClaimed() { return claimed; }

    @JsonProperty("succeeded")
    public int getSucceeded() { return succeeded; }

    @JsonProperty("failed")
    public int getFailed() { return failed; }

    @Override
    public String toString() {
        return String.format("TickSummary{checked=%d, claimed=%d, succeeded=%d, failed=%d}",
                checked, claimed, succeeded, failed);
    }
}
