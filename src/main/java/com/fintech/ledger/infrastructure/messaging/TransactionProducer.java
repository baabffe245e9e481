package com.fintech.ledger.infrastructure.messaging;

import com.fintech.ledger.domain.exception.LedgerException;
import com.fintech.ledger.domain.model.Transaction;
import com.fintech.ledger.domain.service.TransactionSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Reads transactions from a source and sends them, in source order, onto the channel.
 *
 * Termination:
 * - Input exhausted: normal completion
 * - Cancellation observed before a read or before a blocking send: clean stop,
 *   the pending transaction is dropped whole
 * - Decode or send failure: the producer stops and reports the failure
 *
 * The channel is closed on every exit path so the consumer can drain and finish.
 */
@Slf4j
@RequiredArgsConstructor
public class TransactionProducer implements Callable<TransactionProducer.Report> {

    private final TransactionSource source;
    private final BoundedChannel<Transaction> channel;
    private final CancellationToken cancellationToken;
    private final MeterRegistry meterRegistry;

    @Override
    public Report call() {
        long sent = 0;
        try {
            while (true) {
                if (cancellationToken.isCancelled()) {
                    log.info("Reading {} cancelled after {} transactions", source.describe(), sent);
                    return new Report(sent, true, null);
                }

                Optional<Transaction> next = source.next();
                if (next.isEmpty()) {
                    log.info("Finished reading {}: {} transactions sent", source.describe(), sent);
                    return new Report(sent, false, null);
                }

                if (!channel.send(next.get(), cancellationToken)) {
                    log.info("Reading {} cancelled after {} transactions", source.describe(), sent);
                    return new Report(sent, true, null);
                }
                sent++;

                Counter.builder("ledger.transactions.received")
                        .register(meterRegistry)
                        .increment();
            }
        } catch (LedgerException e) {
            log.error("Error reading {} after {} transactions [{}]: {}",
                    source.describe(), sent, e.getErrorCode().getCode(), e.getMessage());
            return new Report(sent, false, e);
        } finally {
            channel.close();
        }
    }

    @Value
    public static class Report {
        long sent;
        boolean cancelled;
        LedgerException failure;
    }
}
