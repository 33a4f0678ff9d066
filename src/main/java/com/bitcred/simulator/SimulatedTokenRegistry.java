package com.bitcred.simulator;

import com.bitcred.exception.BusinessException;
import com.bitcred.exception.ErrorCode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Simulated tokens by symbol, for the simulator endpoints.
 */
public class SimulatedTokenRegistry {

    private final Map<String, SimulatedToken> tokens = new LinkedHashMap<>();

    public SimulatedTokenRegistry(List<SimulatedToken> tokens) {
        tokens.forEach(t -> this.tokens.put(t.getSymbol().toUpperCase(Locale.ROOT), t));
    }

    public SimulatedToken get(String symbol) {
        SimulatedToken token = symbol == null ? null : tokens.get(symbol.toUpperCase(Locale.ROOT));
        if (token == null) {
            throw new BusinessException(
                    ErrorCode.NOT_FOUND, "Unknown token: " + symbol, Map.of("symbol", String.valueOf(symbol)));
        }
        return token;
    }

    public List<String> symbols() {
        return List.copyOf(tokens.keySet());
    }
}
