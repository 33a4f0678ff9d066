package com.bitcred.event;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

public class LiquidationEvent extends LedgerEvent {

    private final String user;
    private final String liquidator;
    private final BigInteger debtRepaid;
    private final BigInteger collateralSeized;

    public LiquidationEvent(
            Object source,
            String user,
            String liquidator,
            BigInteger debtRepaid,
            BigInteger collateralSeized,
            long timestamp) {
        super(source, timestamp);
        this.user = user;
        this.liquidator = liquidator;
        this.debtRepaid = debtRepaid;
        this.collateralSeized = collateralSeized;
    }

    public String getUser() {
        return user;
    }

    public String getLiquidator() {
        return liquidator;
    }

    public BigInteger getDebtRepaid() {
        return debtRepaid;
    }

    public BigInteger getCollateralSeized() {
        return collateralSeized;
    }

    @Override
    public String getName() {
        return "Liquidated";
    }

    @Override
    public Map<String, Object> getPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user", user);
        payload.put("liquidator", liquidator);
        payload.put("debt_repaid", debtRepaid);
        payload.put("collateral_seized", collateralSeized);
        return payload;
    }
}
