package com.bitcred.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, ErrorCategory.VALIDATION),
    BAD_REQUEST("BAD_REQUEST", 400, ErrorCategory.VALIDATION),
    UNAUTHORIZED("UNAUTHORIZED", 401, ErrorCategory.AUTHORIZATION),
    NOT_FOUND("NOT_FOUND", 404, ErrorCategory.STATE),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, ErrorCategory.SYSTEM),

    // Score registry
    INVALID_RANGE("INVALID_RANGE", 400, ErrorCategory.VALIDATION),
    NOT_AUTHORIZED("NOT_AUTHORIZED", 403, ErrorCategory.AUTHORIZATION),
    ADMIN_ONLY("ADMIN_ONLY", 403, ErrorCategory.AUTHORIZATION),
    ALREADY_REGISTERED("ALREADY_REGISTERED", 409, ErrorCategory.STATE),
    NOT_REGISTERED("NOT_REGISTERED", 404, ErrorCategory.STATE),
    COOLDOWN_ACTIVE("COOLDOWN_ACTIVE", 409, ErrorCategory.STATE),

    // Lending pool
    INVALID_AMOUNT("INVALID_AMOUNT", 400, ErrorCategory.VALIDATION),
    NO_VALID_SCORE("NO_VALID_SCORE", 422, ErrorCategory.STATE),
    NO_SCORE_LINKED("NO_SCORE_LINKED", 422, ErrorCategory.STATE),
    EXCEEDS_CAPACITY("EXCEEDS_CAPACITY", 422, ErrorCategory.STATE),
    INSUFFICIENT_LIQUIDITY("INSUFFICIENT_LIQUIDITY", 422, ErrorCategory.STATE),
    NO_DEBT("NO_DEBT", 422, ErrorCategory.STATE),
    DEBT_OUTSTANDING("DEBT_OUTSTANDING", 409, ErrorCategory.STATE),
    EXCEEDS_DEPOSITED("EXCEEDS_DEPOSITED", 422, ErrorCategory.STATE),
    POSITION_HEALTHY("POSITION_HEALTHY", 409, ErrorCategory.STATE),

    // Token collaborators
    TRANSFER_FAILED("TRANSFER_FAILED", 502, ErrorCategory.COLLABORATOR);

    private final String code;
    private final int httpStatus;
    private final ErrorCategory category;
}
