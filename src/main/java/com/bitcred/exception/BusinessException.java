package com.bitcred.exception;

import java.util.Map;

/**
 * A well-formed request the current ledger state does not allow (already registered, cooldown
 * active, capacity exceeded, position healthy, ...).
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
