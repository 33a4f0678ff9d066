package com.bitcred.config;

import com.bitcred.api.dto.response.ApiErrorResponse;
import com.bitcred.api.dto.response.ApiResponse;
import java.time.Clock;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps ledger API bodies in an {@link ApiResponse} stamped with the ledger clock.
 *
 * <p>Only /api/** is wrapped; actuator and error bodies keep their own shape. Error envelopes
 * from {@link com.bitcred.exception.GlobalExceptionHandler} pass through unchanged.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private final Clock ledgerClock;

    public ApiResponseAdvice(Clock ledgerClock) {
        this.ledgerClock = ledgerClock;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {

        if (!request.getURI().getPath().startsWith("/api/")) {
            return body;
        }
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }
        return ApiResponse.of(body, ledgerClock.instant().getEpochSecond());
    }
}
