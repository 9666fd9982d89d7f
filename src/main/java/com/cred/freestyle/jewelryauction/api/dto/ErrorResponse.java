package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.exception.AuctionException;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every failing endpoint.
 * {@code code} is the stable auction error code (INSUFFICIENT_BID, AUCTION_NOT_OPEN, ...);
 * {@code retryable} tells clients whether the same request may succeed after a backoff.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private Integer status;
    private String error;
    private String code;
    private String message;
    private String path;
    private boolean retryable;
    private Map<String, Object> details = new LinkedHashMap<>();

    /**
     * Error body for a domain failure. Code, message and retryability come from the exception.
     */
    public static ErrorResponse of(HttpStatus status, String error, AuctionException ex, String path) {
        ErrorResponse response = of(status, error, ex.getCode(), ex.getMessage(), path);
        response.setRetryable(ex.isRetryable());
        return response;
    }

    public static ErrorResponse of(HttpStatus status, String error, String code, String message, String path) {
        ErrorResponse response = new ErrorResponse();
        response.setStatus(status.value());
        response.setError(error);
        response.setCode(code);
        response.setMessage(message);
        response.setPath(path);
        return response;
    }

    public ErrorResponse addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }
}
