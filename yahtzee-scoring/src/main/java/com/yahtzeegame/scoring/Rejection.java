package com.yahtzeegame.scoring;

/**
 * Why a category cannot be scored right now.
 */
public enum Rejection {
    /** The dice do not form a valid roll. */
    ROLL_INVALID,
    /** The category id is not in the catalog. */
    UNKNOWN_CATEGORY,
    /** The box already holds a score. */
    ALREADY_FILLED,
    /** A joker roll has to go to a different box. */
    JOKER_RESTRICTED
}
