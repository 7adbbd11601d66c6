package com.yahtzeegame.scoringservice.config;

import com.yahtzeegame.scoring.JokerRule;
import com.yahtzeegame.scoring.RuleOptions;
import com.yahtzeegame.scoring.ScoringEngine;
import com.yahtzeegame.scoring.ScoringRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single rule catalog the service scores with. House rules come from
 * {@code yahtzee.rules.*} properties.
 */
@Configuration
public class ScoringRulesConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoringRulesConfig.class);

    @Bean
    public RuleOptions ruleOptions(
            @Value("${yahtzee.rules.joker:FORCED}") JokerRule jokerRule,
            @Value("${yahtzee.rules.full-house-allows-five-of-a-kind:false}") boolean fullHouseAllowsFiveOfAKind,
            @Value("${yahtzee.rules.yahtzee-bonus-points:" + RuleOptions.DEFAULT_YAHTZEE_BONUS_POINTS + "}") int yahtzeeBonusPoints,
            @Value("${yahtzee.rules.upper-bonus-threshold:" + RuleOptions.DEFAULT_UPPER_BONUS_THRESHOLD + "}") int upperBonusThreshold,
            @Value("${yahtzee.rules.upper-bonus-points:" + RuleOptions.DEFAULT_UPPER_BONUS_POINTS + "}") int upperBonusPoints) {
        RuleOptions options = RuleOptions.builder()
                .jokerRule(jokerRule)
                .fullHouseAllowsFiveOfAKind(fullHouseAllowsFiveOfAKind)
                .yahtzeeBonusPoints(yahtzeeBonusPoints)
                .upperBonusThreshold(upperBonusThreshold)
                .upperBonusPoints(upperBonusPoints)
                .build();
        log.info("Scoring with {}", options);
        return options;
    }

    @Bean
    public ScoringRules scoringRules(RuleOptions ruleOptions) {
        return ScoringRules.of(ruleOptions);
    }

    @Bean
    public ScoringEngine scoringEngine(ScoringRules scoringRules) {
        return new ScoringEngine(scoringRules);
    }
}
