package com.yahtzeegame.scoringservice.controller;

import com.yahtzeegame.scoringservice.dto.CategoryView;
import com.yahtzeegame.scoringservice.dto.CommitResponse;
import com.yahtzeegame.scoringservice.dto.OptionView;
import com.yahtzeegame.scoringservice.dto.RollRequest;
import com.yahtzeegame.scoringservice.dto.ScoreResponse;
import com.yahtzeegame.scoringservice.dto.ScoresheetView;
import com.yahtzeegame.scoringservice.dto.VerdictResponse;
import com.yahtzeegame.scoringservice.security.JwtUtil;
import com.yahtzeegame.scoringservice.service.ScoresheetService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class ScoresheetController {

    private final ScoresheetService scoresheetService;
    private final JwtUtil jwtUtil;

    public ScoresheetController(ScoresheetService scoresheetService, JwtUtil jwtUtil) {
        this.scoresheetService = scoresheetService;
        this.jwtUtil = jwtUtil;
    }

    /**
     * GET /api/categories
     * List the scoring categories
     */
    @GetMapping("/categories")
    public ResponseEntity<List<CategoryView>> getCategories() {
        return ResponseEntity.ok(scoresheetService.getCategories());
    }

    /**
     * POST /api/score
     * Score a roll against a category, ignoring any scoresheet
     */
    @PostMapping("/score")
    public ResponseEntity<ScoreResponse> score(@RequestBody RollRequest request) {
        return ResponseEntity.ok(scoresheetService.score(request.getFaces(), request.getCategory()));
    }

    /**
     * GET /api/scoresheet
     * Current player's entries and totals
     */
    @GetMapping("/scoresheet")
    public ResponseEntity<ScoresheetView> getScoresheet(@RequestHeader(value = "Authorization", required = false) String authHeader) {
        Long playerId = jwtUtil.extractPlayerId(authHeader);
        return ResponseEntity.ok(scoresheetService.getScoresheet(playerId));
    }

    /**
     * DELETE /api/scoresheet
     * Start a new, empty scoresheet
     */
    @DeleteMapping("/scoresheet")
    public ResponseEntity<ScoresheetView> resetScoresheet(@RequestHeader(value = "Authorization", required = false) String authHeader) {
        Long playerId = jwtUtil.extractPlayerId(authHeader);
        return ResponseEntity.ok(scoresheetService.reset(playerId));
    }

    /**
     * POST /api/scoresheet/validate
     * Check whether a category may be scored with a roll
     */
    @PostMapping("/scoresheet/validate")
    public ResponseEntity<VerdictResponse> validate(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestBody RollRequest request) {

        Long playerId = jwtUtil.extractPlayerId(authHeader);
        return ResponseEntity.ok(scoresheetService.validate(playerId, request.getFaces(), request.getCategory()));
    }

    /**
     * POST /api/scoresheet/commit
     * Score a roll into the current player's sheet
     */
    @PostMapping("/scoresheet/commit")
    public ResponseEntity<CommitResponse> commit(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestBody RollRequest request) {

        Long playerId = jwtUtil.extractPlayerId(authHeader);
        return ResponseEntity.ok(scoresheetService.commit(playerId, request.getFaces(), request.getCategory()));
    }

    /**
     * POST /api/scoresheet/options
     * Categories the roll may legally fill, with their points
     */
    @PostMapping("/scoresheet/options")
    public ResponseEntity<List<OptionView>> getOptions(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestBody RollRequest request) {

        Long playerId = jwtUtil.extractPlayerId(authHeader);
        return ResponseEntity.ok(scoresheetService.getOptions(playerId, request.getFaces()));
    }
}
