package com.yahtzeegame.scoring;

/**
 * Roll shapes that lower-section categories require before they award points.
 */
public enum Pattern {
    ANY("Any five dice") {
        @Override
        public boolean matches(Roll roll) {
            return true;
        }
    },
    THREE_OF_A_KIND("At least three dice the same") {
        @Override
        public boolean matches(Roll roll) {
            return roll.maxCount() >= 3;
        }
    },
    FOUR_OF_A_KIND("At least four dice the same") {
        @Override
        public boolean matches(Roll roll) {
            return roll.maxCount() >= 4;
        }
    },
    /**
     * Three of one face and two of another. Five of a kind is not a full house.
     */
    FULL_HOUSE("Three of one face and two of another") {
        @Override
        public boolean matches(Roll roll) {
            boolean triple = false;
            boolean pair = false;
            for (int face = Roll.MIN_FACE; face <= Roll.MAX_FACE; face++) {
                int count = roll.count(face);
                if (count == 3) {
                    triple = true;
                } else if (count == 2) {
                    pair = true;
                }
            }
            return triple && pair;
        }
    },
    /**
     * House-rule full house that also accepts five of a kind.
     */
    FULL_HOUSE_OR_FIVE_OF_A_KIND("Full house, five of a kind also counts") {
        @Override
        public boolean matches(Roll roll) {
            return FULL_HOUSE.matches(roll) || roll.isFiveOfAKind();
        }
    },
    SMALL_STRAIGHT("Four faces in a row") {
        @Override
        public boolean matches(Roll roll) {
            return longestRun(roll) >= 4;
        }
    },
    LARGE_STRAIGHT("Five faces in a row") {
        @Override
        public boolean matches(Roll roll) {
            return longestRun(roll) == Roll.DICE;
        }
    },
    FIVE_OF_A_KIND("All five dice the same") {
        @Override
        public boolean matches(Roll roll) {
            return roll.isFiveOfAKind();
        }
    };

    private final String description;

    Pattern(String description) {
        this.description = description;
    }

    public abstract boolean matches(Roll roll);

    public String getDescription() {
        return description;
    }

    /**
     * Length of the longest sequence of consecutive faces present in the roll.
     */
    static int longestRun(Roll roll) {
        int longest = 0;
        int current = 0;
        for (int face = Roll.MIN_FACE; face <= Roll.MAX_FACE; face++) {
            if (roll.count(face) > 0) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }
}
