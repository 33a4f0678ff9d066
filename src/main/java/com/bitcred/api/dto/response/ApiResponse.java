package com.bitcred.api.dto.response;

import lombok.Getter;

/**
 * Success envelope for /api/** responses.
 *
 * <p>{@code ledgerTime} is the ledger clock in epoch seconds when the response was written, the
 * same unit as {@code borrowTimestamp} and {@code lastUpdated}, so a client can compute accrued
 * interest against it directly.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final long ledgerTime;

    private ApiResponse(T data, long ledgerTime) {
        this.success = true;
        this.data = data;
        this.ledgerTime = ledgerTime;
    }

    public static <T> ApiResponse<T> of(T data, long ledgerTime) {
        return new ApiResponse<>(data, ledgerTime);
    }
}
