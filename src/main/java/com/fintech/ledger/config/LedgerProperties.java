package com.fintech.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger settings bound from {@code ledger.*}.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Pipeline {

        /**
         * Capacity of the channel between producer and consumer. A full channel
         * blocks the producer.
         */
        private int channelCapacity = 100;

        /**
         * How long a blocked send or receive waits before re-checking
         * cancellation or channel closure.
         */
        private long pollIntervalMs = 50L;

        /**
         * How long an operator interrupt waits for in-flight work and the report.
         */
        private long shutdownTimeoutSeconds = 10L;
    }
}
