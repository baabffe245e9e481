package com.fintech.ledger.infrastructure.csv;

import com.fintech.ledger.domain.exception.ErrorCode;
import com.fintech.ledger.domain.exception.LedgerException;
import com.fintech.ledger.domain.model.Transaction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CsvTransactionSourceTest {

    @Test
    void next_decodesEveryKindWithTrimmedFields() {
        List<Transaction> transactions = readAll(
                "type, client, tx, amount\n" +
                "deposit,   1,  1,  10.5\n" +
                "withdrawal, 1, 2, 2.25\n" +
                "dispute, 1, 1,\n" +
                "resolve, 1, 1\n" +
                "chargeback, 65535, 4294967295,\n");

        assertEquals(5, transactions.size());

        Transaction deposit = transactions.get(0);
        assertEquals(Transaction.Type.DEPOSIT, deposit.getType());
        assertEquals(1, deposit.getClientId());
        assertEquals(1L, deposit.getTransactionId());
        assertEquals(new BigDecimal("10.5"), deposit.getMoneyTransaction().getAmount());

        assertEquals(Transaction.Type.WITHDRAWAL, transactions.get(1).getType());
        assertEquals(Transaction.Type.DISPUTE, transactions.get(2).getType());
        assertEquals(Transaction.Type.RESOLVE, transactions.get(3).getType());

        Transaction chargeback = transactions.get(4);
        assertEquals(Transaction.Type.CHARGEBACK, chargeback.getType());
        assertEquals(65535, chargeback.getClientId());
        assertEquals(4294967295L, chargeback.getTransactionId());
        assertFalse(chargeback.isMoneyTransaction());
    }

    @Test
    void next_skipsBlankLines() {
        List<Transaction> transactions = readAll(
                "type,client,tx,amount\n\ndeposit,1,1,1.0\n\n\ndeposit,2,2,2.0\n");

        assertEquals(2, transactions.size());
        assertEquals(2, transactions.get(1).getClientId());
    }

    @Test
    void next_errorAfterBlankLines_reportsPhysicalLine() {
        CsvTransactionSource source = source("type,client,tx,amount\n\ndeposit,1,1,2.0\n\n\ndeposit,1,2,\n");

        assertTrue(source.next().isPresent());
        LedgerException e = assertThrows(LedgerException.class, source::next);

        assertEquals("Row 6: Deposit requires an amount", e.getMessage());
    }

    @Test
    void next_bindsColumnsByHeaderName() {
        List<Transaction> transactions = readAll(
                "client, amount, type, tx\n" +
                "4, 12.5, deposit, 9\n" +
                "4, , dispute, 9\n");

        assertEquals(2, transactions.size());
        Transaction deposit = transactions.get(0);
        assertEquals(Transaction.Type.DEPOSIT, deposit.getType());
        assertEquals(4, deposit.getClientId());
        assertEquals(9L, deposit.getTransactionId());
        assertEquals(new BigDecimal("12.5"), deposit.getMoneyTransaction().getAmount());
        assertEquals(Transaction.Type.DISPUTE, transactions.get(1).getType());
    }

    @Test
    void next_headerOnly_isEmpty() {
        assertTrue(readAll("type, client, tx, amount\n").isEmpty());
    }

    @Test
    void next_emptyInput_isEmpty() {
        assertTrue(readAll("").isEmpty());
    }

    @Test
    void next_depositWithoutAmount_failsWithRowNumber() {
        CsvTransactionSource source = source("type,client,tx,amount\ndeposit,1,1,5.0\ndeposit,1,2,\n");

        assertTrue(source.next().isPresent());
        LedgerException e = assertThrows(LedgerException.class, source::next);

        assertEquals(ErrorCode.DECODE_ERROR, e.getErrorCode());
        assertEquals("Row 3: Deposit requires an amount", e.getMessage());
    }

    @Test
    void next_withdrawalWithoutAmountColumn_fails() {
        LedgerException e = assertThrows(LedgerException.class,
                () -> source("type,client,tx,amount\nwithdrawal,1,2\n").next());

        assertEquals("Row 2: Withdrawal requires an amount", e.getMessage());
    }

    @Test
    void next_unknownType_fails() {
        LedgerException e = assertThrows(LedgerException.class,
                () -> source("type,client,tx,amount\ntransfer,1,1,1.0\n").next());

        assertEquals(ErrorCode.DECODE_ERROR, e.getErrorCode());
        assertEquals("Row 2: Unknown transaction type: transfer", e.getMessage());
    }

    @Test
    void next_nonPositiveAmount_isDecodeError() {
        LedgerException zero = assertThrows(LedgerException.class,
                () -> source("type,client,tx,amount\ndeposit,1,1,0.0\n").next());
        LedgerException negative = assertThrows(LedgerException.class,
                () -> source("type,client,tx,amount\nwithdrawal,1,1,-3\n").next());

        assertEquals(ErrorCode.DECODE_ERROR, zero.getErrorCode());
        assertEquals(ErrorCode.DECODE_ERROR, negative.getErrorCode());
    }

    @Test
    void next_malformedNumbers_areDecodeErrors() {
        assertDecodeError("deposit,abc,1,1.0", "Invalid client id: 'abc'");
        assertDecodeError("deposit,70000,1,1.0", "Client id out of range: 70000");
        assertDecodeError("deposit,1,-1,1.0", "Transaction id out of range: -1");
        assertDecodeError("deposit,1,4294967296,1.0", "Transaction id out of range: 4294967296");
        assertDecodeError("deposit,1,1,ten", "Invalid amount: 'ten'");
    }

    @Test
    void open_readsFixtureFile() throws Exception {
        Path path = Path.of(getClass().getResource("/input/mixed.csv").toURI());

        try (CsvTransactionSource source = CsvTransactionSource.open(path)) {
            int count = 0;
            while (source.next().isPresent()) {
                count++;
            }
            assertEquals(5, count);
            assertEquals(path.toString(), source.describe());
        }
    }

    @Test
    void open_missingFile_isDecodeError(@TempDir Path dir) {
        LedgerException e = assertThrows(LedgerException.class,
                () -> CsvTransactionSource.open(dir.resolve("absent.csv")));

        assertEquals(ErrorCode.DECODE_ERROR, e.getErrorCode());
        assertTrue(e.getMessage().startsWith("Cannot read"));
    }

    private void assertDecodeError(String row, String expectedMessage) {
        LedgerException e = assertThrows(LedgerException.class,
                () -> source("type,client,tx,amount\n" + row + "\n").next());
        assertEquals(ErrorCode.DECODE_ERROR, e.getErrorCode());
        assertEquals("Row 2: " + expectedMessage, e.getMessage());
    }

    private static CsvTransactionSource source(String csv) {
        return new CsvTransactionSource("test input", new StringReader(csv));
    }

    private static List<Transaction> readAll(String csv) {
        List<Transaction> transactions = new ArrayList<>();
        try (CsvTransactionSource source = source(csv)) {
            Optional<Transaction> next;
            while ((next = source.next()).isPresent()) {
                transactions.add(next.get());
            }
        }
        return transactions;
    }
}
