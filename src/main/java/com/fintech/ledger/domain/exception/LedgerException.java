package com.fintech.ledger.domain.exception;

import lombok.Getter;

/**
 * Base exception for every ledger failure.
 *
 * Account-level errors are local to one transaction: the consumer logs them and
 * moves on. Decode and pipeline errors stop the producer.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    public LedgerException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Account-level errors never stop the stream.
     */
    public boolean isRecoverable() {
        return switch (errorCode) {
            case DECODE_ERROR, CHANNEL_CLOSED, SEND_FAILED -> false;
            default -> true;
        };
    }
}
