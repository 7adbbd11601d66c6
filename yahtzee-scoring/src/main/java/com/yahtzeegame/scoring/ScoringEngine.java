package com.yahtzeegame.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores rolls and fills scoresheets against one rule catalog.
 */
public class ScoringEngine {

    private final ScoringRules rules;

    public ScoringEngine() {
        this(ScoringRules.standard());
    }

    public ScoringEngine(ScoringRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public ScoringRules getRules() {
        return rules;
    }

    /**
     * @throws InvalidRollException if the faces do not make a roll
     */
    public Roll newRoll(int... faces) {
        return Roll.of(faces);
    }

    public List<Category> catalog() {
        return rules.getCategories();
    }

    public Verdict validate(Scoresheet scoresheet, Roll roll, String categoryId) {
        return Validators.validate(rules, scoresheet, roll, categoryId);
    }

    /**
     * Validate straight from raw dice; a malformed roll comes back as
     * {@link Rejection#ROLL_INVALID} instead of an exception.
     */
    public Verdict validate(Scoresheet scoresheet, List<Integer> faces, String categoryId) {
        Roll roll;
        try {
            roll = Roll.of(faces);
        } catch (InvalidRollException e) {
            return Verdict.rejected(Rejection.ROLL_INVALID, e.getMessage());
        }
        return validate(scoresheet, roll, categoryId);
    }

    /**
     * Points the category gives the roll under the normal rules, independent of any
     * scoresheet.
     *
     * @throws UnknownCategoryException if the id is not in the catalog
     */
    public int score(Roll roll, String categoryId) {
        return rules.category(categoryId).score(roll);
    }

    /**
     * Points committing the roll to the category would award on this sheet, counting
     * joker scoring but not the Yahtzee bonus.
     */
    public int preview(Scoresheet scoresheet, Roll roll, String categoryId) {
        Category category = rules.category(categoryId);
        return pointsFor(category, roll, usesJoker(scoresheet, roll));
    }

    /**
     * Validate, then record the score and any Yahtzee bonus. Nothing changes when the
     * choice is rejected.
     *
     * @return the same scoresheet
     * @throws ScoreRejectedException if validation fails
     */
    public Scoresheet commit(Scoresheet scoresheet, Roll roll, String categoryId) {
        Verdict verdict = validate(scoresheet, roll, categoryId);
        if (!verdict.isOk()) {
            throw new ScoreRejectedException(verdict);
        }

        Category category = rules.category(categoryId);
        boolean bonus = Validators.isJokerRoll(rules, scoresheet, roll);
        boolean joker = usesJoker(scoresheet, roll);
        int points = pointsFor(category, roll, joker);

        scoresheet.record(new ScoreEntry(category.getId(), points, joker), bonus);
        return scoresheet;
    }

    public ScoreTotals totals(Scoresheet scoresheet) {
        return ScoreTotals.of(rules, scoresheet);
    }

    /**
     * Every category that may be scored for the roll right now, in catalog order,
     * with the points each would award.
     */
    public List<ScoreOption> options(Scoresheet scoresheet, Roll roll) {
        boolean joker = usesJoker(scoresheet, roll);
        List<ScoreOption> options = new ArrayList<>();
        for (Category category : rules.getCategories()) {
            if (Validators.validate(rules, scoresheet, roll, category).isOk()) {
                options.add(new ScoreOption(category, pointsFor(category, roll, joker), joker));
            }
        }
        return options;
    }

    public boolean isComplete(Scoresheet scoresheet) {
        return rules.getCategories().stream().allMatch(c -> scoresheet.isFilled(c.getId()));
    }

    private boolean usesJoker(Scoresheet scoresheet, Roll roll) {
        return rules.getOptions().getJokerRule() != JokerRule.DISABLED
                && Validators.isJokerRoll(rules, scoresheet, roll);
    }

    private static int pointsFor(Category category, Roll roll, boolean joker) {
        return joker ? category.jokerScore(roll) : category.score(roll);
    }
}
