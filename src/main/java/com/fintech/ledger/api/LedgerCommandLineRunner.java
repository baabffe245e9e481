package com.fintech.ledger.api;

import com.fintech.ledger.config.LedgerProperties;
import com.fintech.ledger.domain.exception.LedgerException;
import com.fintech.ledger.domain.service.AccountManager;
import com.fintech.ledger.domain.service.PipelineResult;
import com.fintech.ledger.domain.service.TransactionPipeline;
import com.fintech.ledger.infrastructure.csv.AccountReportWriter;
import com.fintech.ledger.infrastructure.csv.CsvTransactionSource;
import com.fintech.ledger.infrastructure.messaging.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line surface: {@code ledger <csv_file>}.
 *
 * Runs the pipeline over the file, then prints the account report to standard output.
 * An operator interrupt raises the cancellation token from a shutdown hook, which then
 * waits for the pipeline to drain and the report to be written.
 *
 * Exit codes:
 * - 0: input fully processed or cleanly cancelled
 * - 1: usage error
 * - 2: the stream stopped on malformed or unreadable input
 */
@Slf4j
@Component
public class LedgerCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_INPUT_FAILURE = 2;

    private final TransactionPipeline pipeline;
    private final AccountManager accountManager;
    private final AccountReportWriter reportWriter;
    private final LedgerProperties properties;
    private final PrintStream out;
    private final PrintStream err;

    private final CancellationToken cancellationToken = new CancellationToken();
    private final CountDownLatch finished = new CountDownLatch(1);
    private int exitCode = EXIT_OK;

    @Autowired
    public LedgerCommandLineRunner(TransactionPipeline pipeline, AccountManager accountManager,
                                   AccountReportWriter reportWriter, LedgerProperties properties) {
        this(pipeline, accountManager, reportWriter, properties, System.out, System.err);
    }

    LedgerCommandLineRunner(TransactionPipeline pipeline, AccountManager accountManager,
                            AccountReportWriter reportWriter, LedgerProperties properties,
                            PrintStream out, PrintStream err) {
        this.pipeline = pipeline;
        this.accountManager = accountManager;
        this.reportWriter = reportWriter;
        this.properties = properties;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) throws IOException {
        if (args.length < 1) {
            err.println("Usage: ledger <csv_file>");
            exitCode = EXIT_USAGE;
            return;
        }

        Path input = Path.of(args[0]);
        log.info("Processing file: {}", input);

        Thread interruptHook = new Thread(this::cancelAndAwait, "ledger-interrupt");
        Runtime.getRuntime().addShutdownHook(interruptHook);
        try {
            exitCode = process(input);
        } finally {
            finished.countDown();
            removeHook(interruptHook);
        }
    }

    int process(Path input) throws IOException {
        int code = EXIT_OK;
        try (CsvTransactionSource source = CsvTransactionSource.open(input)) {
            PipelineResult result = pipeline.run(source, cancellationToken);

            if (result.isCancelled()) {
                err.println("Processing cancelled, reporting transactions applied so far");
            }
            if (result.getProducerFailure().isPresent()) {
                err.println("Error processing CSV: " + result.getProducerFailure().get().getMessage());
                code = EXIT_INPUT_FAILURE;
            }
        } catch (LedgerException e) {
            log.error("Cannot process {}: {}", input, e.getMessage());
            err.println("Error processing CSV: " + e.getMessage());
            return EXIT_INPUT_FAILURE;
        }

        writeReport();
        log.info("Processing complete: {} accounts", accountManager.totalAccounts());
        return code;
    }

    /**
     * Raises the cancellation signal. Safe to call from any thread.
     */
    public void cancel() {
        if (cancellationToken.cancel()) {
            log.info("Cancellation requested");
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void writeReport() throws IOException {
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        reportWriter.write(accountManager.snapshot(), writer);
    }

    private void cancelAndAwait() {
        if (finished.getCount() == 0) {
            return;
        }
        err.println();
        err.println("Received interrupt, shutting down gracefully...");
        cancel();
        try {
            long timeout = properties.getPipeline().getShutdownTimeoutSeconds();
            if (!finished.await(timeout, TimeUnit.SECONDS)) {
                log.warn("Pipeline did not finish within {}s of the interrupt", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            log.debug("Shutdown in progress, keeping interrupt hook");
        }
    }
}
