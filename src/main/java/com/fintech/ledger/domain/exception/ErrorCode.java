package com.fintech.ledger.domain.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes for ledger processing.
 * Format: CATEGORY_NNN
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ===== ACCOUNT ERRORS (ACCT_XXX) =====
    ACCOUNT_LOCKED("ACCT_001", "Account is locked"),
    INSUFFICIENT_FUNDS("ACCT_002", "Insufficient funds"),

    // ===== TRANSACTION ERRORS (TXN_XXX) =====
    DUPLICATE_TRANSACTION_ID("TXN_001", "Transaction ID already exists"),
    TRANSACTION_NOT_FOUND("TXN_002", "Transaction not found"),
    INVALID_AMOUNT("TXN_003", "Transaction amount must be positive"),

    // ===== DISPUTE ERRORS (DSP_XXX) =====
    ALREADY_DISPUTED("DSP_001", "Transaction is already under dispute"),
    ALREADY_CHARGEDBACK("DSP_002", "Cannot dispute a chargedback transaction"),
    NOT_DISPUTED("DSP_003", "Transaction is not under dispute"),

    // ===== INPUT ERRORS (INPUT_XXX) =====
    DECODE_ERROR("INPUT_001", "Malformed transaction record"),

    // ===== PIPELINE ERRORS (PIPE_XXX) =====
    CHANNEL_CLOSED("PIPE_001", "Transaction channel is closed"),
    SEND_FAILED("PIPE_002", "Failed to send transaction");

    private final String code;
    private final String defaultMessage;
}
