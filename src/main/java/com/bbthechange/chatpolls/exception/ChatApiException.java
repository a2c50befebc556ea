package com.bbthechange.chatpolls.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the chat REST API answers with a non-2xx status.
 * Carries the HTTP status and, when the body has one, the platform's JSON error code.
 */
public class ChatApiException extends RuntimeException {

    private final ErrorType errorType;
    private final int status;
    private final Integer code;

    public enum ErrorType {
        /**
         * Missing or invalid bot token (HTTP 401).
         */
        UNAUTHORIZED(HttpStatus.UNAUTHORIZED),

        /**
         * Token lacks access to the channel or message (HTTP 403).
         */
        FORBIDDEN(HttpStatus.FORBIDDEN),

        /**
         * Unknown channel, message or answer (HTTP 404).
         */
        NOT_FOUND(HttpStatus.NOT_FOUND),

        /**
         * Rate limited (HTTP 429). Not retried here.
         */
        RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),

        /**
         * Platform-side failure (HTTP 5xx), reported as an upstream 502.
         */
        SERVER_ERROR(HttpStatus.BAD_GATEWAY),

        /**
         * Any other rejected request, usually HTTP 400.
         */
        REQUEST_FAILED(HttpStatus.BAD_REQUEST);

        private final HttpStatus httpStatus;

        ErrorType(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }

        public HttpStatus getHttpStatus() {
            return httpStatus;
        }

        public static ErrorType fromStatus(int status) {
            switch (status) {
                case 401:
                    return UNAUTHORIZED;
                case 403:
                    return FORBIDDEN;
                case 404:
                    return NOT_FOUND;
                case 429:
                    return RATE_LIMITED;
                default:
                    return status >= 500 ? SERVER_ERROR : REQUEST_FAILED;
            }
        }
    }

    public ChatApiException(int status, Integer code, String message) {
        super(message);
        this.errorType = ErrorType.fromStatus(status);
        this.status = status;
        this.code = code;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Platform JSON error code, or null when the response body had none.
     */
    public Integer getCode() {
        return code;
    }

    public HttpStatus getHttpStatus() {
        return errorType.getHttpStatus();
    }

    /**
     * Factory method for a rejected request, formatted like "404 Not Found (error code: 10008): Unknown Message".
     */
    public static ChatApiException fromResponse(int status, Integer code, String errorMessage) {
        HttpStatus resolved = HttpStatus.resolve(status);
        StringBuilder text = new StringBuilder().append(status);
        if (resolved != null) {
            text.append(' ').append(resolved.getReasonPhrase());
        }
        if (code != null) {
            text.append(" (error code: ").append(code).append(')');
        }
        if (errorMessage != null && !errorMessage.isEmpty()) {
            text.append(": ").append(errorMessage);
        }
        return new ChatApiException(status, code, text.toString());
    }
}
