package com.yahtzeegame.scoring;

import java.util.Objects;

/**
 * Outcome of validating a category choice: legal, or rejected with a reason.
 */
public final class Verdict {

    private static final Verdict OK = new Verdict(null, null);

    private final Rejection reason;
    private final String message;

    private Verdict(Rejection reason, String message) {
        this.reason = reason;
        this.message = message;
    }

    public static Verdict ok() {
        return OK;
    }

    public static Verdict rejected(Rejection reason, String message) {
        return new Verdict(Objects.requireNonNull(reason, "reason"), message);
    }

    public boolean isOk() {
        return reason == null;
    }

    /**
     * @return the rejection reason, or {@code null} when the choice is legal
     */
    public Rejection getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Verdict)) return false;
        Verdict other = (Verdict) o;
        return reason == other.reason && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, message);
    }

    @Override
    public String toString() {
        return isOk() ? "OK" : reason + ": " + message;
    }
}
