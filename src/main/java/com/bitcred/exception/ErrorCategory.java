package com.bitcred.exception;

/**
 * Coarse classification of an {@link ErrorCode}, letting callers branch on the kind of failure
 * without enumerating every code.
 */
public enum ErrorCategory {

    /** Malformed input: out-of-range score, zero amount, bad request body. */
    VALIDATION,

    /** Caller lacks the role the operation requires. */
    AUTHORIZATION,

    /** Input is well-formed but the current ledger state forbids the operation. */
    STATE,

    /** An external collaborator (token) reported failure. */
    COLLABORATOR,

    /** Unexpected internal failure. */
    SYSTEM
}
