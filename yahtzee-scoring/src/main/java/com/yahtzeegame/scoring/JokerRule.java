package com.yahtzeegame.scoring;

/**
 * Variants of the joker rule, applied when a Yahtzee is rolled after the Yahtzee box
 * already holds a positive score. The bonus is credited under every variant.
 */
public enum JokerRule {
    /**
     * Official rules: the matching upper box if it is open, otherwise any open lower
     * box at full value, otherwise any open upper box at zero.
     */
    FORCED,
    /**
     * Any open box; lower boxes score at full value.
     */
    FREE_CHOICE,
    /**
     * No substitution: the roll only scores what the normal rules give it.
     */
    DISABLED
}
