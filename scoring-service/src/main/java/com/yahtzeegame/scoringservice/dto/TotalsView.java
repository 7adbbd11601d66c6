package com.yahtzeegame.scoringservice.dto;

import com.yahtzeegame.scoring.ScoreTotals;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TotalsView {
    private int upperSubtotal;
    private int upperBonus;
    private int lowerSubtotal;
    private int yahtzeeBonus;
    private int grandTotal;

    public static TotalsView from(ScoreTotals totals) {
        return TotalsView.builder()
                .upperSubtotal(totals.getUpperSubtotal())
                .upperBonus(totals.getUpperBonus())
                .lowerSubtotal(totals.getLowerSubtotal())
                .yahtzeeBonus(totals.getYahtzeeBonus())
                .grandTotal(totals.getGrandTotal())
                .build();
    }
}
