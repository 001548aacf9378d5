package com.kmg.repost.model;

/**
 * Result of one external action. {@code detail} is carried verbatim into the schedule's last result.
 */
public record ActionOutcome(boolean ok, String detail) {
    public static ActionOutcome succeeded(String detail) {
        return new ActionOutcome(true, detail);
    }

    public static ActionOutcome failed(String detail) {
        return new ActionOutcome(false, detail);
    }

    public String toResultText() {
        return (ok ? "OK: " : "ERR: ") + detail;
    }
}
