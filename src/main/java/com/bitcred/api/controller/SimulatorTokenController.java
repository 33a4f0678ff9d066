package com.bitcred.api.controller;

import com.bitcred.api.dto.request.ApproveRequest;
import com.bitcred.api.dto.request.MintRequest;
import com.bitcred.auth.CallerAccountFilter;
import com.bitcred.simulator.SimulatedToken;
import com.bitcred.simulator.SimulatedTokenRegistry;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the simulated collateral and borrow tokens.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/simulator/tokens -- known symbols</li>
 *   <li>POST /api/simulator/tokens/{symbol}/mint -- mint to any account</li>
 *   <li>POST /api/simulator/tokens/{symbol}/approve -- caller sets a spender allowance</li>
 *   <li>GET /api/simulator/tokens/{symbol}/balances/{account} -- balance</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/simulator/tokens")
public class SimulatorTokenController {

    private final SimulatedTokenRegistry simulatedTokenRegistry;

    public SimulatorTokenController(SimulatedTokenRegistry simulatedTokenRegistry) {
        this.simulatedTokenRegistry = simulatedTokenRegistry;
    }

    @GetMapping
    public ResponseEntity<List<String>> listTokens() {
        return ResponseEntity.ok(simulatedTokenRegistry.symbols());
    }

    @PostMapping("/{symbol}/mint")
    public ResponseEntity<Map<String, Object>> mint(
            @PathVariable String symbol, @Valid @RequestBody MintRequest request) {
        SimulatedToken token = simulatedTokenRegistry.get(symbol);
        String account = CallerAccountFilter.parseAccount(request.getAccount());
        token.mint(account, request.getAmount());
        return ResponseEntity.ok(balance(token, account));
    }

    @PostMapping("/{symbol}/approve")
    public ResponseEntity<Map<String, Object>> approve(
            @RequestAttribute(CallerAccountFilter.CALLER_ATTRIBUTE) String caller,
            @PathVariable String symbol,
            @Valid @RequestBody ApproveRequest request) {
        SimulatedToken token = simulatedTokenRegistry.get(symbol);
        String spender = CallerAccountFilter.parseAccount(request.getSpender());
        token.approve(caller, spender, request.getAmount());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", token.getSymbol());
        body.put("owner", caller);
        body.put("spender", spender);
        body.put("allowance", token.allowance(caller, spender));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{symbol}/balances/{account}")
    public ResponseEntity<Map<String, Object>> balanceOf(@PathVariable String symbol, @PathVariable String account) {
        SimulatedToken token = simulatedTokenRegistry.get(symbol);
        return ResponseEntity.ok(balance(token, CallerAccountFilter.parseAccount(account)));
    }

    private static Map<String, Object> balance(SimulatedToken token, String account) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", token.getSymbol());
        body.put("account", account);
        body.put("balance", token.balanceOf(account));
        return body;
    }
}
