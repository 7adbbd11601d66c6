package com.yahtzeegame.scoring;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoringRulesTest {

    @Test
    void testLookup() {
        ScoringRules rules = ScoringRules.standard();
        assertEquals("Full House", rules.category("full_house").getDisplayName());
        assertTrue(rules.findCategory("chance").isPresent());
        assertTrue(rules.findCategory("bogus").isEmpty());
        assertEquals("yahtzee", rules.yahtzeeCategory().getId());
        assertEquals("fives", rules.upperCategoryFor(5).orElseThrow().getId());
        assertTrue(rules.upperCategoryFor(7).isEmpty());
    }

    @Test
    void testUnknownCategory() {
        UnknownCategoryException ex = assertThrows(UnknownCategoryException.class,
                () -> ScoringRules.standard().category("sevens"));
        assertEquals("sevens", ex.getCategoryId());
        assertThrows(UnknownCategoryException.class, () -> ScoringRules.standard().category(null));
    }

    @Test
    void testDuplicateIdsRejected() {
        List<Category> categories = List.of(
                Category.total("chance", "Chance", Pattern.ANY),
                Category.fixed("chance", "Also Chance", Pattern.FIVE_OF_A_KIND, 50));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new ScoringRules(categories, RuleOptions.defaults()));
        assertTrue(ex.getMessage().contains("Duplicate ids are: [chance]"));
    }

    @Test
    void testYahtzeeCategoryRequired() {
        List<Category> categories = List.of(Category.total("chance", "Chance", Pattern.ANY));
        assertThrows(IllegalArgumentException.class, () -> new ScoringRules(categories, RuleOptions.defaults()));
    }

    @Test
    void testCustomCatalog() {
        List<Category> categories = List.of(
                Category.face("sixes", "Sixes", 6),
                Category.fixed("kniffel", "Kniffel", Pattern.FIVE_OF_A_KIND, 50));
        ScoringRules rules = new ScoringRules(categories, RuleOptions.defaults());
        assertEquals("kniffel", rules.yahtzeeCategory().getId());
        assertEquals(2, rules.getCategories().size());
    }

    @Test
    void testInvalidCategoryDefinitions() {
        assertThrows(IllegalArgumentException.class, () -> Category.face("sevens", "Sevens", 7));
        assertThrows(IllegalArgumentException.class, () -> Category.fixed("neg", "Negative", Pattern.ANY, -1));
        assertThrows(IllegalArgumentException.class, () -> Category.total(" ", "Blank", Pattern.ANY));
    }

    @Test
    void testOptionDefaults() {
        RuleOptions options = RuleOptions.defaults();
        assertEquals(JokerRule.FORCED, options.getJokerRule());
        assertFalse(options.isFullHouseAllowsFiveOfAKind());
        assertEquals(100, options.getYahtzeeBonusPoints());
        assertEquals(63, options.getUpperBonusThreshold());
        assertEquals(35, options.getUpperBonusPoints());
        assertThrows(IllegalArgumentException.class, () -> RuleOptions.builder().yahtzeeBonusPoints(-5).build());
    }
}
