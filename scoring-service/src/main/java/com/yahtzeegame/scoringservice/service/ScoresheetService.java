package com.yahtzeegame.scoringservice.service;

import com.yahtzeegame.scoring.Category;
import com.yahtzeegame.scoring.Roll;
import com.yahtzeegame.scoring.ScoreEntry;
import com.yahtzeegame.scoring.ScoreRejectedException;
import com.yahtzeegame.scoring.Scoresheet;
import com.yahtzeegame.scoring.ScoringEngine;
import com.yahtzeegame.scoring.Verdict;
import com.yahtzeegame.scoringservice.dto.CategoryView;
import com.yahtzeegame.scoringservice.dto.CommitResponse;
import com.yahtzeegame.scoringservice.dto.OptionView;
import com.yahtzeegame.scoringservice.dto.ScoreResponse;
import com.yahtzeegame.scoringservice.dto.ScoresheetView;
import com.yahtzeegame.scoringservice.dto.TotalsView;
import com.yahtzeegame.scoringservice.dto.VerdictResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keeps one in-memory scoresheet per player and runs every request through the
 * scoring engine. Each sheet is locked on its own, so two players never wait on
 * each other. A player's sheet is created once and never replaced.
 */
@Service
public class ScoresheetService {

    private static final Logger log = LoggerFactory.getLogger(ScoresheetService.class);

    private final ScoringEngine engine;
    private final Map<Long, Scoresheet> sheets = new ConcurrentHashMap<>();

    public ScoresheetService(ScoringEngine engine) {
        this.engine = engine;
    }

    /**
     * All categories in scoresheet order
     */
    public List<CategoryView> getCategories() {
        return engine.catalog().stream()
                .map(CategoryView::from)
                .collect(Collectors.toList());
    }

    /**
     * Score a roll against a category without touching any sheet
     */
    public ScoreResponse score(List<Integer> faces, String categoryId) {
        Roll roll = Roll.of(faces);
        return ScoreResponse.builder()
                .category(categoryId)
                .faces(roll.getFaces())
                .points(engine.score(roll, categoryId))
                .build();
    }

    public VerdictResponse validate(Long playerId, List<Integer> faces, String categoryId) {
        Scoresheet sheet = sheetFor(playerId);
        Verdict verdict;
        synchronized (sheet) {
            verdict = engine.validate(sheet, faces, categoryId);
        }
        log.debug("Player {} validate {} {} -> {}", playerId, faces, categoryId, verdict);
        return VerdictResponse.from(categoryId, verdict);
    }

    /**
     * Commit a roll to the player's sheet
     */
    public CommitResponse commit(Long playerId, List<Integer> faces, String categoryId) {
        Roll roll = Roll.of(faces);
        Scoresheet sheet = sheetFor(playerId);

        synchronized (sheet) {
            int bonusesBefore = sheet.getBonusYahtzees();
            try {
                engine.commit(sheet, roll, categoryId);
            } catch (ScoreRejectedException e) {
                log.warn("Player {} could not score {} in {}: {}", playerId, roll, categoryId, e.getMessage());
                throw e;
            }

            ScoreEntry entry = sheet.getEntry(categoryId).orElseThrow();
            boolean bonus = sheet.getBonusYahtzees() > bonusesBefore;
            TotalsView totals = TotalsView.from(engine.totals(sheet));
            log.info("Player {} scored {} in {}{} (total {})", playerId, entry.getScore(), categoryId,
                    bonus ? " with Yahtzee bonus" : "", totals.getGrandTotal());

            return CommitResponse.builder()
                    .category(categoryId)
                    .points(entry.getScore())
                    .joker(entry.isJoker())
                    .bonusYahtzee(bonus)
                    .totals(totals)
                    .build();
        }
    }

    /**
     * Every category the player may fill with this roll
     */
    public List<OptionView> getOptions(Long playerId, List<Integer> faces) {
        Roll roll = Roll.of(faces);
        Scoresheet sheet = sheetFor(playerId);
        synchronized (sheet) {
            return engine.options(sheet, roll).stream()
                    .map(OptionView::from)
                    .collect(Collectors.toList());
        }
    }

    public ScoresheetView getScoresheet(Long playerId) {
        Scoresheet sheet = sheetFor(playerId);
        synchronized (sheet) {
            Map<String, Integer> entries = new LinkedHashMap<>();
            for (Category category : engine.catalog()) {
                entries.put(category.getId(),
                        sheet.getEntry(category.getId()).map(ScoreEntry::getScore).orElse(null));
            }
            return ScoresheetView.builder()
                    .playerId(playerId)
                    .entries(entries)
                    .bonusYahtzees(sheet.getBonusYahtzees())
                    .complete(engine.isComplete(sheet))
                    .totals(TotalsView.from(engine.totals(sheet)))
                    .build();
        }
    }

    /**
     * Empty the player's sheet. The sheet object stays the same, so a commit holding
     * its lock finishes before the reset runs.
     */
    public ScoresheetView reset(Long playerId) {
        Scoresheet sheet = sheetFor(playerId);
        synchronized (sheet) {
            sheet.clear();
            log.info("Player {} started a new scoresheet", playerId);
            return getScoresheet(playerId);
        }
    }

    private Scoresheet sheetFor(Long playerId) {
        return sheets.computeIfAbsent(playerId, id -> new Scoresheet());
    }
}
