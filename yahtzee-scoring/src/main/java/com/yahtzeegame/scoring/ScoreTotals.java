package com.yahtzeegame.scoring;

/**
 * Totals derived from a scoresheet at one point in time.
 */
public final class ScoreTotals {

    private final int upperSubtotal;
    private final int upperBonus;
    private final int lowerSubtotal;
    private final int yahtzeeBonus;

    public ScoreTotals(int upperSubtotal, int upperBonus, int lowerSubtotal, int yahtzeeBonus) {
        this.upperSubtotal = upperSubtotal;
        this.upperBonus = upperBonus;
        this.lowerSubtotal = lowerSubtotal;
        this.yahtzeeBonus = yahtzeeBonus;
    }

    /**
     * Sum the filled boxes of a sheet section by section and apply both bonuses.
     */
    public static ScoreTotals of(ScoringRules rules, Scoresheet scoresheet) {
        RuleOptions options = rules.getOptions();
        int upper = sectionSubtotal(rules, scoresheet, Section.UPPER);
        int lower = sectionSubtotal(rules, scoresheet, Section.LOWER);
        int upperBonus = upper >= options.getUpperBonusThreshold() ? options.getUpperBonusPoints() : 0;
        int yahtzeeBonus = scoresheet.getBonusYahtzees() * options.getYahtzeeBonusPoints();
        return new ScoreTotals(upper, upperBonus, lower, yahtzeeBonus);
    }

    private static int sectionSubtotal(ScoringRules rules, Scoresheet scoresheet, Section section) {
        return rules.categories(section).stream()
                .mapToInt(c -> scoresheet.getEntry(c.getId()).map(ScoreEntry::getScore).orElse(0))
                .sum();
    }

    public int getUpperSubtotal() {
        return upperSubtotal;
    }

    public int getUpperBonus() {
        return upperBonus;
    }

    public boolean hasUpperBonus() {
        return upperBonus > 0;
    }

    public int getLowerSubtotal() {
        return lowerSubtotal;
    }

    public int getYahtzeeBonus() {
        return yahtzeeBonus;
    }

    public int getGrandTotal() {
        return upperSubtotal + upperBonus + lowerSubtotal + yahtzeeBonus;
    }

    @Override
    public String toString() {
        return "Upper: " + upperSubtotal
                + "\nUpper bonus: " + upperBonus
                + "\nLower: " + lowerSubtotal
                + "\nYahtzee bonus: " + yahtzeeBonus
                + "\nTotal: " + getGrandTotal();
    }
}
