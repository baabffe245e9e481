package com.fintech.ledger.infrastructure.messaging;

import com.fintech.ledger.domain.exception.LedgerException;
import com.fintech.ledger.domain.model.Transaction;
import com.fintech.ledger.domain.service.AccountManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Drains the channel and applies each transaction to the account store.
 *
 * A rejected transaction is logged and counted; processing continues with the
 * next one. Runs until the channel is closed and empty. It never looks at the
 * cancellation token: the producer closing the channel is the only stop signal.
 */
@Slf4j
@RequiredArgsConstructor
public class TransactionConsumer implements Callable<TransactionConsumer.Report> {

    private final BoundedChannel<Transaction> channel;
    private final AccountManager accountManager;
    private final MeterRegistry meterRegistry;

    @Override
    public Report call() throws InterruptedException {
        long applied = 0;
        long rejected = 0;

        Optional<Transaction> received;
        while ((received = channel.receive()).isPresent()) {
            if (consume(received.get())) {
                applied++;
            } else {
                rejected++;
            }
        }

        log.info("Channel closed: {} transactions applied, {} rejected", applied, rejected);
        return new Report(applied, rejected);
    }

    /**
     * @return true if the transaction was applied
     */
    boolean consume(Transaction transaction) {
        String type = transaction.getType().name();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            log.debug("Received transaction: {}", transaction);

            accountManager.process(transaction);

            sample.stop(Timer.builder("ledger.transactions.processing.latency")
                    .tag("type", type)
                    .register(meterRegistry));

            Counter.builder("ledger.transactions.processed")
                    .tag("result", "success")
                    .tag("type", type)
                    .register(meterRegistry)
                    .increment();

            return true;

        } catch (LedgerException e) {
            if (!e.isRecoverable()) {
                return failed(transaction, type, e);
            }
            log.warn("Transaction {} for client {} rejected [{}]: {}",
                    transaction.getTransactionId(), transaction.getClientId(),
                    e.getErrorCode().getCode(), e.getMessage());

            Counter.builder("ledger.transactions.processed")
                    .tag("result", "rejected")
                    .tag("type", type)
                    .register(meterRegistry)
                    .increment();

            Counter.builder("ledger.transactions.rejected")
                    .tag("reason", e.getErrorCode().name())
                    .register(meterRegistry)
                    .increment();

            return false;

        } catch (RuntimeException e) {
            return failed(transaction, type, e);
        }
    }

    private boolean failed(Transaction transaction, String type, RuntimeException e) {
        log.error("Error processing transaction {} for client {}: {}",
                transaction.getTransactionId(), transaction.getClientId(), e.getMessage(), e);

        Counter.builder("ledger.transactions.processed")
                .tag("result", "error")
                .tag("type", type)
                .register(meterRegistry)
                .increment();

        return false;
    }

    @Value
    public static class Report {
        long applied;
        long rejected;
    }
}
