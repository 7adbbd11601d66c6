package com.yahtzeegame.scoringservice.controller;

import com.yahtzeegame.scoring.InvalidRollException;
import com.yahtzeegame.scoring.Rejection;
import com.yahtzeegame.scoring.ScoreRejectedException;
import com.yahtzeegame.scoring.UnknownCategoryException;
import com.yahtzeegame.scoringservice.dto.ErrorResponse;
import com.yahtzeegame.scoringservice.security.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns scoring failures into JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRollException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRoll(InvalidRollException e) {
        return error(HttpStatus.BAD_REQUEST, Rejection.ROLL_INVALID.name(), e.getMessage());
    }

    @ExceptionHandler(UnknownCategoryException.class)
    public ResponseEntity<ErrorResponse> handleUnknownCategory(UnknownCategoryException e) {
        return error(HttpStatus.NOT_FOUND, Rejection.UNKNOWN_CATEGORY.name(), e.getMessage());
    }

    @ExceptionHandler(ScoreRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(ScoreRejectedException e) {
        HttpStatus status = switch (e.getReason()) {
            case UNKNOWN_CATEGORY -> HttpStatus.NOT_FOUND;
            case ROLL_INVALID -> HttpStatus.BAD_REQUEST;
            case ALREADY_FILLED, JOKER_RESTRICTED -> HttpStatus.CONFLICT;
        };
        return error(status, e.getReason().name(), e.getMessage());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return error(HttpStatus.UNAUTHORIZED, null, e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.getReasonPhrase(), reason, message));
    }
}
