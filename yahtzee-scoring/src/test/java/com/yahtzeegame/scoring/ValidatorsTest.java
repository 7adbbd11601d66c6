package com.yahtzeegame.scoring;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorsTest {

    private final ScoringRules rules = ScoringRules.standard();

    private static Scoresheet sheetWith(String... filled) {
        Scoresheet sheet = new Scoresheet();
        for (String id : filled) {
            sheet.record(new ScoreEntry(id, id.equals(DefaultRules.YAHTZEE) ? 50 : 0, false), false);
        }
        return sheet;
    }

    @Test
    void testOpenCategoryIsLegal() {
        Verdict verdict = Validators.validate(rules, new Scoresheet(), Roll.of(1, 2, 3, 4, 5), "chance");
        assertTrue(verdict.isOk());
        assertNull(verdict.getReason());
    }

    @Test
    void testPatternMissIsStillLegal() {
        // scoring zero in a box is a legal choice
        Verdict verdict = Validators.validate(rules, new Scoresheet(), Roll.of(1, 1, 2, 2, 6), "large_straight");
        assertTrue(verdict.isOk());
    }

    @Test
    void testAlreadyFilled() {
        Scoresheet sheet = sheetWith("chance");
        Verdict verdict = Validators.validate(rules, sheet, Roll.of(1, 2, 3, 4, 5), "chance");
        assertEquals(Rejection.ALREADY_FILLED, verdict.getReason());
    }

    @Test
    void testUnknownCategory() {
        Verdict verdict = Validators.validate(rules, new Scoresheet(), Roll.of(1, 2, 3, 4, 5), "sevens");
        assertEquals(Rejection.UNKNOWN_CATEGORY, verdict.getReason());
    }

    @Test
    void testMissingRoll() {
        Verdict verdict = Validators.validate(rules, new Scoresheet(), null, "chance");
        assertEquals(Rejection.ROLL_INVALID, verdict.getReason());
    }

    @Test
    void testJokerRollRequiresPositiveYahtzee() {
        Roll fives = Roll.of(5, 5, 5, 5, 5);
        assertFalse(Validators.isJokerRoll(rules, new Scoresheet(), fives), "Empty Yahtzee box");

        Scoresheet zeroed = new Scoresheet();
        zeroed.record(new ScoreEntry(DefaultRules.YAHTZEE, 0, false), false);
        assertFalse(Validators.isJokerRoll(rules, zeroed, fives), "Yahtzee box scratched with zero");

        Scoresheet scored = sheetWith(DefaultRules.YAHTZEE);
        assertTrue(Validators.isJokerRoll(rules, scored, fives));
        assertFalse(Validators.isJokerRoll(rules, scored, Roll.of(5, 5, 5, 5, 4)));
    }

    @Test
    void testScratchedYahtzeeLeavesNormalRules() {
        Scoresheet sheet = new Scoresheet();
        sheet.record(new ScoreEntry(DefaultRules.YAHTZEE, 0, false), false);
        Roll sixes = Roll.of(6, 6, 6, 6, 6);
        assertTrue(Validators.validate(rules, sheet, sixes, "chance").isOk(), "No joker restriction without a bonus");
        assertEquals(Rejection.ALREADY_FILLED, Validators.validate(rules, sheet, sixes, "yahtzee").getReason());
    }

    @Test
    void testFilledCategoryWithJokerRoll() {
        Scoresheet sheet = sheetWith(DefaultRules.YAHTZEE, DefaultRules.CHANCE);
        Roll twos = Roll.of(2, 2, 2, 2, 2);
        assertEquals(Rejection.JOKER_RESTRICTED, Validators.validate(rules, sheet, twos, "yahtzee").getReason());
        assertEquals(Rejection.JOKER_RESTRICTED, Validators.validate(rules, sheet, twos, "chance").getReason());
    }

    @Test
    void testForcedJokerSteersToMatchingUpperBox() {
        Scoresheet sheet = sheetWith(DefaultRules.YAHTZEE);
        Roll sixes = Roll.of(6, 6, 6, 6, 6);
        assertTrue(Validators.validate(rules, sheet, sixes, "sixes").isOk());

        Verdict lower = Validators.validate(rules, sheet, sixes, "large_straight");
        assertEquals(Rejection.JOKER_RESTRICTED, lower.getReason());
        assertTrue(lower.getMessage().contains("sixes"));
        assertEquals(Rejection.JOKER_RESTRICTED, Validators.validate(rules, sheet, sixes, "ones").getReason());
    }

    @Test
    void testForcedJokerThenLowerSection() {
        Scoresheet sheet = sheetWith(DefaultRules.YAHTZEE, DefaultRules.SIXES);
        Roll sixes = Roll.of(6, 6, 6, 6, 6);
        assertTrue(Validators.validate(rules, sheet, sixes, "full_house").isOk());
        assertTrue(Validators.validate(rules, sheet, sixes, "small_straight").isOk());
        assertTrue(Validators.validate(rules, sheet, sixes, "chance").isOk());
        assertEquals(Rejection.JOKER_RESTRICTED, Validators.validate(rules, sheet, sixes, "twos").getReason());
    }

    @Test
    void testForcedJokerFallsBackToUpperSection() {
        Scoresheet sheet = sheetWith(DefaultRules.SIXES, DefaultRules.THREE_OF_A_KIND, DefaultRules.FOUR_OF_A_KIND,
                DefaultRules.FULL_HOUSE, DefaultRules.SMALL_STRAIGHT, DefaultRules.LARGE_STRAIGHT,
                DefaultRules.YAHTZEE, DefaultRules.CHANCE);
        Roll sixes = Roll.of(6, 6, 6, 6, 6);
        assertTrue(Validators.validate(rules, sheet, sixes, "ones").isOk());
        assertTrue(Validators.validate(rules, sheet, sixes, "fives").isOk());
    }

    @Test
    void testFreeChoiceJoker() {
        ScoringRules free = ScoringRules.of(RuleOptions.builder().jokerRule(JokerRule.FREE_CHOICE).build());
        Scoresheet sheet = sheetWith(DefaultRules.YAHTZEE);
        Roll sixes = Roll.of(6, 6, 6, 6, 6);
        assertTrue(Validators.validate(free, sheet, sixes, "ones").isOk());
        assertTrue(Validators.validate(free, sheet, sixes, "large_straight").isOk());
        assertEquals(Rejection.JOKER_RESTRICTED, Validators.validate(free, sheet, sixes, "yahtzee").getReason());
    }

    @Test
    void testDisabledJokerHasNoRestriction() {
        ScoringRules disabled = ScoringRules.of(RuleOptions.builder().jokerRule(JokerRule.DISABLED).build());
        Scoresheet sheet = sheetWith(DefaultRules.YAHTZEE);
        assertTrue(Validators.validate(disabled, sheet, Roll.of(6, 6, 6, 6, 6), "ones").isOk());
    }

    @Test
    void testValidationDoesNotMutate() {
        Scoresheet sheet = sheetWith(DefaultRules.YAHTZEE);
        Validators.validate(rules, sheet, Roll.of(6, 6, 6, 6, 6), "sixes");
        assertEquals(1, sheet.size());
        assertEquals(0, sheet.getBonusYahtzees());
    }
}
