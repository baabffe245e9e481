package com.fintech.ledger.domain.service;

import com.fintech.ledger.config.LedgerProperties;
import com.fintech.ledger.domain.model.Transaction;
import com.fintech.ledger.infrastructure.messaging.BoundedChannel;
import com.fintech.ledger.infrastructure.messaging.CancellationToken;
import com.fintech.ledger.infrastructure.messaging.TransactionConsumer;
import com.fintech.ledger.infrastructure.messaging.TransactionProducer;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams transactions from a source into the account store.
 *
 * Architecture:
 * - One producer thread: reads + decodes + sends onto a bounded channel
 * - One consumer thread: receives + applies to {@link AccountManager}
 * - The two synchronize only through the channel and the store's lock
 *
 * Backpressure:
 * - A full channel blocks the producer until the consumer drains an element
 *
 * Cancellation:
 * - Cooperative, observed by the producer before each read and each blocking send
 * - A send or account update already in flight completes, so the store only ever
 *   holds whole transactions
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionPipeline {

    private final AccountManager accountManager;
    private final LedgerProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Runs the pipeline to completion: input exhausted, producer failure or cancellation.
     * Returns once the consumer has applied everything that was sent.
     */
    public PipelineResult run(TransactionSource source, CancellationToken cancellationToken) {
        LedgerProperties.Pipeline settings = properties.getPipeline();
        BoundedChannel<Transaction> channel =
                new BoundedChannel<>(settings.getChannelCapacity(), settings.getPollIntervalMs());

        log.info("Starting pipeline for {} (channel capacity {})", source.describe(), settings.getChannelCapacity());

        ExecutorService executor = Executors.newFixedThreadPool(2, pipelineThreadFactory());
        try {
            Future<TransactionProducer.Report> producer = executor.submit(
                    new TransactionProducer(source, channel, cancellationToken, meterRegistry));
            Future<TransactionConsumer.Report> consumer = executor.submit(
                    new TransactionConsumer(channel, accountManager, meterRegistry));

            TransactionProducer.Report produced = producer.get();
            TransactionConsumer.Report consumed = consumer.get();

            PipelineResult result = PipelineResult.builder()
                    .sent(produced.getSent())
                    .applied(consumed.getApplied())
                    .rejected(consumed.getRejected())
                    .cancelled(produced.isCancelled())
                    .producerFailure(produced.getFailure())
                    .build();

            log.info("Pipeline finished: sent={}, applied={}, rejected={}, cancelled={}",
                    result.getSent(), result.getApplied(), result.getRejected(), result.isCancelled());
            return result;

        } catch (ExecutionException e) {
            channel.close();
            throw new IllegalStateException("Pipeline task failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellationToken.cancel();
            throw new IllegalStateException("Interrupted while waiting for the pipeline", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory pipelineThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            String name = counter.getAndIncrement() == 0 ? "ledger-producer" : "ledger-consumer";
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
