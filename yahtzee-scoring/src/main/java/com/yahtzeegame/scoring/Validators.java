package com.yahtzeegame.scoring;

import java.util.Optional;

/**
 * Decides whether a category may be scored for a roll, given the state of a
 * scoresheet. Never mutates anything, so it can be re-run on every attempt.
 */
public final class Validators {

    private Validators() {
    }

    /**
     * A joker roll is a Yahtzee rolled after the Yahtzee box was filled with a
     * positive score. A zero in the Yahtzee box never earns a bonus.
     */
    public static boolean isJokerRoll(ScoringRules rules, Scoresheet scoresheet, Roll roll) {
        if (roll == null || !roll.isFiveOfAKind()) {
            return false;
        }
        return scoresheet.getEntry(rules.yahtzeeCategory().getId())
                .map(entry -> entry.getScore() > 0)
                .orElse(false);
    }

    public static Verdict validate(ScoringRules rules, Scoresheet scoresheet, Roll roll, String categoryId) {
        Optional<Category> category = rules.findCategory(categoryId);
        if (category.isEmpty()) {
            return Verdict.rejected(Rejection.UNKNOWN_CATEGORY, "Unknown category: " + categoryId);
        }
        return validate(rules, scoresheet, roll, category.get());
    }

    public static Verdict validate(ScoringRules rules, Scoresheet scoresheet, Roll roll, Category category) {
        if (roll == null) {
            return Verdict.rejected(Rejection.ROLL_INVALID, "No roll to score");
        }

        boolean joker = isJokerRoll(rules, scoresheet, roll);
        if (scoresheet.isFilled(category.getId())) {
            if (joker) {
                return Verdict.rejected(Rejection.JOKER_RESTRICTED,
                        "Category " + category.getId() + " is filled; a joker roll must go to an open category");
            }
            return Verdict.rejected(Rejection.ALREADY_FILLED,
                    "Category " + category.getId() + " has already been scored");
        }

        if (joker && rules.getOptions().getJokerRule() == JokerRule.FORCED) {
            return checkForcedJoker(rules, scoresheet, roll, category);
        }
        return Verdict.ok();
    }

    // Matching upper box first, then any lower box, then any upper box.
    private static Verdict checkForcedJoker(ScoringRules rules, Scoresheet scoresheet, Roll roll, Category category) {
        int face = roll.getFaces().get(0);
        Optional<Category> matching = rules.upperCategoryFor(face);
        if (matching.isPresent() && !scoresheet.isFilled(matching.get().getId())) {
            if (matching.get().getId().equals(category.getId())) {
                return Verdict.ok();
            }
            return Verdict.rejected(Rejection.JOKER_RESTRICTED,
                    "Joker roll must be scored in " + matching.get().getId() + " while it is open");
        }

        boolean lowerOpen = rules.categories(Section.LOWER).stream()
                .anyMatch(c -> !scoresheet.isFilled(c.getId()));
        if (lowerOpen && category.getSection() != Section.LOWER) {
            return Verdict.rejected(Rejection.JOKER_RESTRICTED,
                    "Joker roll must be scored in an open lower section category");
        }
        return Verdict.ok();
    }
}
