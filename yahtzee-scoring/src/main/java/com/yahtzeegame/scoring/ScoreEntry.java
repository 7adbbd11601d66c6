package com.yahtzeegame.scoring;

import java.util.Objects;

/**
 * One filled box on a scoresheet.
 */
public final class ScoreEntry {

    private final String categoryId;
    private final int score;
    private final boolean joker;

    public ScoreEntry(String categoryId, int score, boolean joker) {
        this.categoryId = Objects.requireNonNull(categoryId, "categoryId");
        if (score < 0) {
            throw new IllegalArgumentException("Score must not be negative: " + score);
        }
        this.score = score;
        this.joker = joker;
    }

    public String getCategoryId() {
        return categoryId;
    }

    public int getScore() {
        return score;
    }

    /**
     * Whether the box was filled with a joker roll.
     */
    public boolean isJoker() {
        return joker;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoreEntry)) return false;
        ScoreEntry other = (ScoreEntry) o;
        return score == other.score && joker == other.joker && categoryId.equals(other.categoryId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(categoryId, score, joker);
    }

    @Override
    public String toString() {
        return categoryId + "=" + score + (joker ? " (joker)" : "");
    }
}
