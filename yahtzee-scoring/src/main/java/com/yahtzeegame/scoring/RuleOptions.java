package com.yahtzeegame.scoring;

import java.util.Objects;

/**
 * House-rule switches and bonus constants for a rule catalog.
 */
public final class RuleOptions {

    public static final int DEFAULT_YAHTZEE_BONUS_POINTS = 100;
    public static final int DEFAULT_UPPER_BONUS_THRESHOLD = 63;
    public static final int DEFAULT_UPPER_BONUS_POINTS = 35;

    private static final RuleOptions DEFAULTS = builder().build();

    private final JokerRule jokerRule;
    private final boolean fullHouseAllowsFiveOfAKind;
    private final int yahtzeeBonusPoints;
    private final int upperBonusThreshold;
    private final int upperBonusPoints;

    private RuleOptions(Builder builder) {
        this.jokerRule = Objects.requireNonNull(builder.jokerRule, "jokerRule");
        this.fullHouseAllowsFiveOfAKind = builder.fullHouseAllowsFiveOfAKind;
        this.yahtzeeBonusPoints = requireNonNegative(builder.yahtzeeBonusPoints, "yahtzeeBonusPoints");
        this.upperBonusThreshold = requireNonNegative(builder.upperBonusThreshold, "upperBonusThreshold");
        this.upperBonusPoints = requireNonNegative(builder.upperBonusPoints, "upperBonusPoints");
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }

    public static RuleOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public JokerRule getJokerRule() {
        return jokerRule;
    }

    public boolean isFullHouseAllowsFiveOfAKind() {
        return fullHouseAllowsFiveOfAKind;
    }

    public int getYahtzeeBonusPoints() {
        return yahtzeeBonusPoints;
    }

    public int getUpperBonusThreshold() {
        return upperBonusThreshold;
    }

    public int getUpperBonusPoints() {
        return upperBonusPoints;
    }

    @Override
    public String toString() {
        return "RuleOptions{joker=" + jokerRule
                + ", fullHouseAllowsFiveOfAKind=" + fullHouseAllowsFiveOfAKind
                + ", yahtzeeBonus=" + yahtzeeBonusPoints
                + ", upperBonus=" + upperBonusPoints + "@" + upperBonusThreshold + "}";
    }

    public static final class Builder {
        private JokerRule jokerRule = JokerRule.FORCED;
        private boolean fullHouseAllowsFiveOfAKind;
        private int yahtzeeBonusPoints = DEFAULT_YAHTZEE_BONUS_POINTS;
        private int upperBonusThreshold = DEFAULT_UPPER_BONUS_THRESHOLD;
        private int upperBonusPoints = DEFAULT_UPPER_BONUS_POINTS;

        private Builder() {
        }

        public Builder jokerRule(JokerRule jokerRule) {
            this.jokerRule = jokerRule;
            return this;
        }

        public Builder fullHouseAllowsFiveOfAKind(boolean allowed) {
            this.fullHouseAllowsFiveOfAKind = allowed;
            return this;
        }

        public Builder yahtzeeBonusPoints(int points) {
            this.yahtzeeBonusPoints = points;
            return this;
        }

        public Builder upperBonusThreshold(int threshold) {
            this.upperBonusThreshold = threshold;
            return this;
        }

        public Builder upperBonusPoints(int points) {
            this.upperBonusPoints = points;
            return this;
        }

        public RuleOptions build() {
            return new RuleOptions(this);
        }
    }
}
