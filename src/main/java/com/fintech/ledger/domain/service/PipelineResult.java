package com.fintech.ledger.domain.service;

import com.fintech.ledger.domain.exception.LedgerException;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of one pipeline run.
 */
@Value
@Builder
public class PipelineResult {
    long sent;
    long applied;
    long rejected;
    boolean cancelled;
    LedgerException producerFailure;

    public Optional<LedgerException> getProducerFailure() {
        return Optional.ofNullable(producerFailure);
    }

    public boolean isCompleted() {
        return !cancelled && producerFailure == null;
    }
}
