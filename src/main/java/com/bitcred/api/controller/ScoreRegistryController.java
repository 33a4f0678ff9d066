package com.bitcred.api.controller;

import com.bitcred.api.dto.request.RegisterScoreRequest;
import com.bitcred.api.dto.request.UpdateScoreRequest;
import com.bitcred.api.dto.response.ScoreResponse;
import com.bitcred.auth.CallerAccountFilter;
import com.bitcred.domain.model.ScoreRecord;
import com.bitcred.exception.ErrorCode;
import com.bitcred.exception.ValidationException;
import com.bitcred.mapper.LedgerDtoMapper;
import com.bitcred.registry.ScoreKeys;
import com.bitcred.registry.ScoreRegistry;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the score registry.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/registry/scores -- register a score (approved scorers)</li>
 *   <li>PUT /api/registry/scores/{scoreId} -- update a score (owner or approved scorer, 30-day cooldown)</li>
 *   <li>GET /api/registry/scores/{scoreId} -- score, tier, ratio and owner</li>
 *   <li>GET /api/registry/addresses/{btcAddress} -- same view, keyed by raw Bitcoin address</li>
 *   <li>POST /api/registry/scorers/{account} -- approve a scorer (admin)</li>
 *   <li>DELETE /api/registry/scorers/{account} -- revoke a scorer (admin)</li>
 *   <li>GET /api/registry/scorers/{account} -- approval status</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/registry")
public class ScoreRegistryController {

    private static final Logger log = LoggerFactory.getLogger(ScoreRegistryController.class);

    private final ScoreRegistry scoreRegistry;
    private final LedgerDtoMapper ledgerDtoMapper;

    public ScoreRegistryController(ScoreRegistry scoreRegistry, LedgerDtoMapper ledgerDtoMapper) {
        this.scoreRegistry = scoreRegistry;
        this.ledgerDtoMapper = ledgerDtoMapper;
    }

    @PostMapping("/scores")
    public ResponseEntity<ScoreResponse> registerScore(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller,
            @Valid @RequestBody RegisterScoreRequest request) {
        String scoreId = resolveScoreId(request);
        log.info("Score registration requested: id={}, caller={}", scoreId, caller);
        ScoreRecord scoreRecord = scoreRegistry.registerScore(caller, scoreId, request.getScore(), request.getProof());
        return ResponseEntity.status(HttpStatus.CREATED).body(ledgerDtoMapper.toResponse(scoreRecord));
    }

    @PutMapping("/scores/{scoreId}")
    public ResponseEntity<ScoreResponse> updateScore(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller,
            @PathVariable String scoreId,
            @Valid @RequestBody UpdateScoreRequest request) {
        ScoreRecord scoreRecord = scoreRegistry.updateScore(caller, scoreId, request.getScore(), request.getProof());
        return ResponseEntity.ok(ledgerDtoMapper.toResponse(scoreRecord));
    }

    /**
     * Unregistered identifiers return score 0 rather than 404.
     */
    @GetMapping("/scores/{scoreId}")
    public ResponseEntity<ScoreResponse> getScore(@PathVariable String scoreId) {
        return ResponseEntity.ok(view(scoreId));
    }

    @GetMapping("/addresses/{btcAddress}")
    public ResponseEntity<ScoreResponse> getScoreByAddress(@PathVariable String btcAddress) {
        return ResponseEntity.ok(view(ScoreKeys.fromBtcAddress(btcAddress)));
    }

    @PostMapping("/scorers/{account}")
    public ResponseEntity<Map<String, Object>> approveScorer(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller, @PathVariable String account) {
        String scorer = CallerAccountFilter.parseAccount(account);
        scoreRegistry.approveScorer(caller, scorer);
        return ResponseEntity.ok(scorerStatus(scorer));
    }

    @DeleteMapping("/scorers/{account}")
    public ResponseEntity<Map<String, Object>> revokeScorer(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller, @PathVariable String account) {
        String scorer = CallerAccountFilter.parseAccount(account);
        scoreRegistry.revokeScorer(caller, scorer);
        return ResponseEntity.ok(scorerStatus(scorer));
    }

    @GetMapping("/scorers/{account}")
    public ResponseEntity<Map<String, Object>> getScorer(@PathVariable String account) {
        return ResponseEntity.ok(scorerStatus(CallerAccountFilter.parseAccount(account)));
    }

    private ScoreResponse view(String scoreId) {
        ScoreRecord scoreRecord = scoreRegistry.findRecord(scoreId).orElseGet(() -> ScoreRecord.builder()
                .scoreId(scoreId)
                .score(0)
                .owner(ScoreRegistry.ZERO_ACCOUNT)
                .lastUpdated(0L)
                .build());
        return ledgerDtoMapper.toResponse(scoreRecord);
    }

    private Map<String, Object> scorerStatus(String account) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("account", account);
        status.put("approved", scoreRegistry.isApprovedScorer(account));
        return status;
    }

    private static String resolveScoreId(RegisterScoreRequest request) {
        if (request.getScoreId() != null && !request.getScoreId().isBlank()) {
            return request.getScoreId().trim();
        }
        if (request.getBtcAddress() != null && !request.getBtcAddress().isBlank()) {
            return ScoreKeys.fromBtcAddress(request.getBtcAddress());
        }
        throw new ValidationException(ErrorCode.VALIDATION_ERROR, "Either scoreId or btcAddress is required");
    }
}
