package com.yahtzeegame.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One player's ledger of filled boxes and bonus Yahtzees.
 *
 * <p>Changes only through {@link ScoringEngine#commit} and {@link #clear}. Not thread-safe: callers that
 * share a sheet between threads must serialize access themselves.
 */
public class Scoresheet {

    private final Map<String, ScoreEntry> entries = new LinkedHashMap<>();
    private int bonusYahtzees;

    public boolean isFilled(String categoryId) {
        return entries.containsKey(categoryId);
    }

    public Optional<ScoreEntry> getEntry(String categoryId) {
        return Optional.ofNullable(entries.get(categoryId));
    }

    /**
     * Filled boxes keyed by category id, in the order they were filled.
     */
    public Map<String, ScoreEntry> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    public int getBonusYahtzees() {
        return bonusYahtzees;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Empty every box and drop the bonus count, keeping this sheet instance.
     */
    public void clear() {
        entries.clear();
        bonusYahtzees = 0;
    }

    void record(ScoreEntry entry, boolean bonusYahtzee) {
        if (entries.containsKey(entry.getCategoryId())) {
            throw new IllegalStateException("Category " + entry.getCategoryId() + " has already been scored");
        }
        entries.put(entry.getCategoryId(), entry);
        if (bonusYahtzee) {
            bonusYahtzees++;
        }
    }

    @Override
    public String toString() {
        return "Scoresheet{entries=" + entries.values() + ", bonusYahtzees=" + bonusYahtzees + "}";
    }
}
