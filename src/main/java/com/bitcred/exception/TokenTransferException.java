package com.bitcred.exception;

import java.math.BigInteger;
import java.util.Map;

/**
 * A token collaborator rejected a transfer. Aborts the enclosing ledger operation.
 */
public class TokenTransferException extends BaseException {

    public TokenTransferException(String token, String from, String to, BigInteger amount) {
        super(
                ErrorCode.TRANSFER_FAILED,
                String.format("%s transfer of %s from %s to %s was rejected", token, amount, from, to),
                Map.of("token", token, "from", from, "to", to, "amount", amount));
    }
}
