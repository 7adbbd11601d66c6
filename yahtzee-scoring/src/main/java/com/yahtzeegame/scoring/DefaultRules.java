package com.yahtzeegame.scoring;

import java.util.List;

/**
 * The thirteen standard Yahtzee boxes.
 */
public final class DefaultRules {

    public static final String ONES = "ones";
    public static final String TWOS = "twos";
    public static final String THREES = "threes";
    public static final String FOURS = "fours";
    public static final String FIVES = "fives";
    public static final String SIXES = "sixes";
    public static final String THREE_OF_A_KIND = "three_of_a_kind";
    public static final String FOUR_OF_A_KIND = "four_of_a_kind";
    public static final String FULL_HOUSE = "full_house";
    public static final String SMALL_STRAIGHT = "small_straight";
    public static final String LARGE_STRAIGHT = "large_straight";
    public static final String YAHTZEE = "yahtzee";
    public static final String CHANCE = "chance";

    public static final int FULL_HOUSE_POINTS = 25;
    public static final int SMALL_STRAIGHT_POINTS = 30;
    public static final int LARGE_STRAIGHT_POINTS = 40;
    public static final int YAHTZEE_POINTS = 50;

    private DefaultRules() {
    }

    /**
     * Standard categories in scoresheet order. The full house pattern follows
     * {@link RuleOptions#isFullHouseAllowsFiveOfAKind()}.
     */
    public static List<Category> categories(RuleOptions options) {
        Pattern fullHouse = options.isFullHouseAllowsFiveOfAKind()
                ? Pattern.FULL_HOUSE_OR_FIVE_OF_A_KIND
                : Pattern.FULL_HOUSE;

        return List.of(
                Category.face(ONES, "Aces (Ones)", 1),
                Category.face(TWOS, "Twos", 2),
                Category.face(THREES, "Threes", 3),
                Category.face(FOURS, "Fours", 4),
                Category.face(FIVES, "Fives", 5),
                Category.face(SIXES, "Sixes", 6),
                Category.total(THREE_OF_A_KIND, "Three of a Kind", Pattern.THREE_OF_A_KIND),
                Category.total(FOUR_OF_A_KIND, "Four of a Kind", Pattern.FOUR_OF_A_KIND),
                Category.fixed(FULL_HOUSE, "Full House", fullHouse, FULL_HOUSE_POINTS),
                Category.fixed(SMALL_STRAIGHT, "Small Straight", Pattern.SMALL_STRAIGHT, SMALL_STRAIGHT_POINTS),
                Category.fixed(LARGE_STRAIGHT, "Large Straight", Pattern.LARGE_STRAIGHT, LARGE_STRAIGHT_POINTS),
                Category.fixed(YAHTZEE, "Yahtzee", Pattern.FIVE_OF_A_KIND, YAHTZEE_POINTS),
                Category.total(CHANCE, "Chance", Pattern.ANY)
        );
    }
}
