package com.market.pulse.enricher.common.exception;

import com.market.pulse.enricher.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        } else {
            String errorCode = r.getErrorCode();
            if (errorCode == null) {
                return ResponseEntity.badRequest().body(r.getError());
            }

            HttpStatus status = switch (errorCode) {
                case "ERR-BUS-001", "ERR-NEWS-001", "ERR-NEWS-002", "ERR-NEWS-003" -> HttpStatus.SERVICE_UNAVAILABLE;
                case "ERR-EVT-001", "ERR-VAL-001" -> HttpStatus.BAD_REQUEST;
                case "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
                default -> HttpStatus.BAD_REQUEST;
            };

            return ResponseEntity.status(status).body(new ErrorResponse(r.getErrorCode(), r.getError(), r.getTimestamp()));
        }
    }

    /**
     * Simple error response structure that will be returned to clients
     */
    private record ErrorResponse(String code, String message, java.time.Instant timestamp) {}
}
