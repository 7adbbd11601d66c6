package com.yahtzeegame.scoring;

/**
 * Thrown by a commit that failed validation. The scoresheet is left untouched.
 */
public class ScoreRejectedException extends IllegalStateException {

    private final Verdict verdict;

    public ScoreRejectedException(Verdict verdict) {
        super(verdict.getMessage());
        this.verdict = verdict;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public Rejection getReason() {
        return verdict.getReason();
    }
}
