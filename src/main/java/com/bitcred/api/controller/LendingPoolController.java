package com.bitcred.api.controller;

import com.bitcred.api.dto.request.AmountRequest;
import com.bitcred.api.dto.request.DepositCollateralRequest;
import com.bitcred.api.dto.response.PoolStatusResponse;
import com.bitcred.api.dto.response.PositionResponse;
import com.bitcred.auth.CallerAccountFilter;
import com.bitcred.domain.model.ReconciliationResult;
import com.bitcred.lending.LendingPool;
import com.bitcred.mapper.LedgerDtoMapper;
import com.bitcred.reconciliation.PoolReconciliationService;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the lending pool.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/lending/collateral -- deposit collateral against a registered score</li>
 *   <li>POST /api/lending/collateral/withdraw -- withdraw collateral (no debt outstanding)</li>
 *   <li>POST /api/lending/borrow -- borrow at the live tier ratio</li>
 *   <li>POST /api/lending/repay -- repay up to the accrued debt</li>
 *   <li>POST /api/lending/liquidate/{user} -- liquidate an unhealthy position</li>
 *   <li>POST /api/lending/liquidity -- fund the pool (admin)</li>
 *   <li>GET /api/lending/positions -- all positions</li>
 *   <li>GET /api/lending/positions/{user} -- one position with accrued debt and health factor</li>
 *   <li>GET /api/lending/pool -- pool aggregates</li>
 *   <li>POST /api/lending/reconciliation -- trigger on-demand reconciliation</li>
 * </ul>
 *
 * <p>Token movements require the caller to have approved the pool account on the relevant token
 * beforehand (see the simulator endpoints).
 */
@RestController
@RequestMapping("/api/lending")
public class LendingPoolController {

    private static final Logger log = LoggerFactory.getLogger(LendingPoolController.class);

    private final LendingPool lendingPool;
    private final PoolReconciliationService poolReconciliationService;
    private final LedgerDtoMapper ledgerDtoMapper;

    public LendingPoolController(
            LendingPool lendingPool,
            PoolReconciliationService poolReconciliationService,
            LedgerDtoMapper ledgerDtoMapper) {
        this.lendingPool = lendingPool;
        this.poolReconciliationService = poolReconciliationService;
        this.ledgerDtoMapper = ledgerDtoMapper;
    }

    @PostMapping("/collateral")
    public ResponseEntity<PositionResponse> depositCollateral(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller,
            @Valid @RequestBody DepositCollateralRequest request) {
        lendingPool.depositCollateral(caller, request.getAmount(), request.getScoreId());
        return ResponseEntity.ok(position(caller));
    }

    @PostMapping("/collateral/withdraw")
    public ResponseEntity<PositionResponse> withdrawCollateral(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller,
            @Valid @RequestBody AmountRequest request) {
        lendingPool.withdrawCollateral(caller, request.getAmount());
        return ResponseEntity.ok(position(caller));
    }

    @PostMapping("/borrow")
    public ResponseEntity<PositionResponse> borrow(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller,
            @Valid @RequestBody AmountRequest request) {
        lendingPool.borrow(caller, request.getAmount());
        return ResponseEntity.ok(position(caller));
    }

    @PostMapping("/repay")
    public ResponseEntity<Map<String, Object>> repay(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller,
            @Valid @RequestBody AmountRequest request) {
        BigInteger repaid = lendingPool.repay(caller, request.getAmount());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("repaid", repaid);
        body.put("position", position(caller));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/liquidate/{user}")
    public ResponseEntity<Map<String, Object>> liquidate(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller, @PathVariable String user) {
        String borrower = CallerAccountFilter.parseAccount(user);
        log.info("Liquidation requested: user={}, liquidator={}", borrower, caller);
        BigInteger seized = lendingPool.liquidate(caller, borrower);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", borrower);
        body.put("liquidator", caller);
        body.put("collateralSeized", seized);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/liquidity")
    public ResponseEntity<PoolStatusResponse> addLiquidity(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller,
            @Valid @RequestBody AmountRequest request) {
        lendingPool.addLiquidity(caller, request.getAmount());
        return ResponseEntity.ok(poolStatus());
    }

    @GetMapping("/positions")
    public ResponseEntity<List<PositionResponse>> listPositions() {
        return ResponseEntity.ok(ledgerDtoMapper.toResponseList(lendingPool.getPositions()));
    }

    @GetMapping("/positions/{user}")
    public ResponseEntity<PositionResponse> getPosition(@PathVariable String user) {
        return ResponseEntity.ok(position(CallerAccountFilter.parseAccount(user)));
    }

    @GetMapping("/pool")
    public ResponseEntity<PoolStatusResponse> getPool() {
        return ResponseEntity.ok(poolStatus());
    }

    /**
     * Triggers an on-demand reconciliation of positions against pool aggregates.
     */
    @PostMapping("/reconciliation")
    public ResponseEntity<ReconciliationResult> reconcile() {
        log.info("Manual pool reconciliation triggered");
        return ResponseEntity.ok(poolReconciliationService.manualReconcile());
    }

    private PositionResponse position(String user) {
        return ledgerDtoMapper.toResponse(lendingPool.getPosition(user));
    }

    private PoolStatusResponse poolStatus() {
        PoolStatusResponse response = ledgerDtoMapper.toResponse(lendingPool.getPoolState());
        response.setCollateralSymbol(lendingPool.getCollateralSymbol());
        response.setBorrowSymbol(lendingPool.getBorrowSymbol());
        response.setPoolAccount(lendingPool.getPoolAccount());
        response.setAdmin(lendingPool.getAdmin());
        response.setPositionCount(lendingPool.getStoredPositions().size());
        return response;
    }
}
