package com.bitcred.auth;

import com.bitcred.api.dto.response.ApiErrorResponse;
import com.bitcred.exception.ErrorCode;
import com.bitcred.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the calling account for mutating /api/** requests.
 *
 * <p>Reads the {@value #ACCOUNT_HEADER} header, requires a {@code 0x}-prefixed hex account,
 * canonicalizes it with {@link #normalize} and stores it under {@link #CALLER_ATTRIBUTE} for controllers. Missing or
 * malformed headers get a 401 JSON error. Reads (GET, HEAD, OPTIONS) pass through untouched.
 *
 * <p>Registered as a servlet filter via {@link com.bitcred.config.WebConfig}.
 */
@Component
public class CallerAccountFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CallerAccountFilter.class);

    public static final String ACCOUNT_HEADER = "X-Account";
    public static final String CALLER_ATTRIBUTE = "callerAccount";

    private static final Pattern ACCOUNT_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{1,64}$");

    private final ObjectMapper objectMapper;

    public CallerAccountFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String method = request.getMethod();
        return !request.getRequestURI().startsWith("/api/")
                || "GET".equals(method)
                || "HEAD".equals(method)
                || "OPTIONS".equals(method);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String account = request.getHeader(ACCOUNT_HEADER);

        if (account == null || account.isBlank()) {
            writeUnauthorized(response, request.getRequestURI(), "Missing " + ACCOUNT_HEADER + " header");
            return;
        }
        if (!isValidAccount(account.trim())) {
            log.debug("Rejected malformed account header: {}", account);
            writeUnauthorized(response, request.getRequestURI(), "Malformed " + ACCOUNT_HEADER + " header");
            return;
        }

        request.setAttribute(CALLER_ATTRIBUTE, normalize(account));
        filterChain.doFilter(request, response);
    }

    public static boolean isValidAccount(String account) {
        return account != null && ACCOUNT_PATTERN.matcher(account).matches();
    }

    /**
     * Canonical form of a valid account: lower-case hex with leading zeros dropped, so
     * {@code 0x00AD} and {@code 0xad} name the same account and {@code 0x000} is {@code 0x0}.
     */
    public static String normalize(String account) {
        String digits = account.trim().substring(2).toLowerCase(Locale.ROOT);
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        return "0x" + digits.substring(start);
    }

    /**
     * Validates and normalizes an account taken from a path or body rather than the header.
     */
    public static String parseAccount(String account) {
        String trimmed = account == null ? null : account.trim();
        if (!isValidAccount(trimmed)) {
            throw new ValidationException(
                    ErrorCode.VALIDATION_ERROR, "Malformed account", Map.of("account", String.valueOf(account)));
        }
        return normalize(trimmed);
    }

    private void writeUnauthorized(HttpServletResponse response, String path, String message) throws IOException {
        ApiErrorResponse errorResponse = ApiErrorResponse.of(ErrorCode.UNAUTHORIZED, message, Map.of(), path);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        objectMapper.writeValue(response.getOutputStream(), errorResponse);
    }
}
