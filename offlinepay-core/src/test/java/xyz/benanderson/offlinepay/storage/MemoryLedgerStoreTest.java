package xyz.benanderson.offlinepay.storage;

import org.junit.jupiter.api.Test;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.exception.ValidationException;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionType;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.benanderson.offlinepay.TestWallets.SENDER_ADDRESS;

class MemoryLedgerStoreTest {

    @Test
    void applyOperationWrites() throws OfflinePayException {
        MemoryLedgerStore ledgerStore = new MemoryLedgerStore();
        PendingTransaction transaction = LedgerFixtures.transaction(TransactionType.SENT, "1", "0x01",
                ledgerStore.getDeviceId());

        String id = ledgerStore.atomically(writer -> {
            writer.addPendingTransaction(transaction);
            writer.updateOfflineBalances(writer.getOfflineBalances().plus(TransactionType.SENT, BigDecimal.ONE));
            writer.saveAllowance(new OfflineAllowance(SENDER_ADDRESS, BigDecimal.TEN, BigDecimal.ONE));
            return transaction.id();
        });

        assertEquals(transaction.id(), id);
        assertEquals(List.of(transaction), ledgerStore.getPendingTransactions());
        assertEquals(transaction, ledgerStore.findPendingTransaction(transaction.id()).orElseThrow());
        assertEquals(new OfflineBalances(BigDecimal.ONE, BigDecimal.ZERO), ledgerStore.getOfflineBalances());
        assertTrue(ledgerStore.findAllowance(SENDER_ADDRESS.toUpperCase().replace("0X", "0x")).isPresent());
    }

    @Test
    void rollBackEveryWriteOnFailure() {
        MemoryLedgerStore ledgerStore = new MemoryLedgerStore();
        PendingTransaction transaction = LedgerFixtures.transaction(TransactionType.SENT, "1", "0x01",
                ledgerStore.getDeviceId());

        assertThrows(StorageException.class, () -> ledgerStore.atomically(writer -> {
            writer.addPendingTransaction(transaction);
            writer.updateOfflineBalances(new OfflineBalances(BigDecimal.ONE, BigDecimal.ZERO));
            writer.saveAllowance(new OfflineAllowance(SENDER_ADDRESS, BigDecimal.TEN, BigDecimal.ONE));
            writer.addPendingTransaction(transaction);
            return null;
        }));

        assertTrue(ledgerStore.getPendingTransactions().isEmpty());
        assertEquals(OfflineBalances.ZERO, ledgerStore.getOfflineBalances());
        assertTrue(ledgerStore.findAllowance(SENDER_ADDRESS).isEmpty());
    }

    @Test
    void rethrowOperationException() {
        MemoryLedgerStore ledgerStore = new MemoryLedgerStore();
        assertThrows(ValidationException.class, () -> ledgerStore.atomically(writer -> {
            writer.updateOfflineBalances(new OfflineBalances(BigDecimal.ONE, BigDecimal.ONE));
            throw new ValidationException("refused");
        }));
        assertEquals(OfflineBalances.ZERO, ledgerStore.getOfflineBalances());
    }

    @Test
    void failUpdateOfUnknownTransaction() {
        MemoryLedgerStore ledgerStore = new MemoryLedgerStore();
        PendingTransaction transaction = LedgerFixtures.transaction(TransactionType.RECEIVED, "1", "0x01", "device");

        assertThrows(StorageException.class, () -> ledgerStore.atomically(writer -> {
            writer.updatePendingTransaction(transaction);
            return null;
        }));
    }

    @Test
    void findByEphemeralAddressAndType() throws OfflinePayException {
        MemoryLedgerStore ledgerStore = new MemoryLedgerStore(LedgerSnapshot.empty());
        PendingTransaction sent = LedgerFixtures.transaction(TransactionType.SENT, "1", "0xab", "device");
        ledgerStore.addPendingTransaction(sent);

        assertEquals(sent, ledgerStore.atomically(
                writer -> writer.findByEphemeralAddress("0xAB", TransactionType.SENT)).orElseThrow());
        assertTrue(ledgerStore.atomically(
                writer -> writer.findByEphemeralAddress("0xab", TransactionType.RECEIVED)).isEmpty());
    }

    @Test
    void readOnlyViewRefusesWrites() throws StorageException {
        MemoryLedgerStore ledgerStore = new MemoryLedgerStore();
        ReadOnlyLedgerStore readOnly = new ReadOnlyLedgerStore(ledgerStore);
        PendingTransaction transaction = LedgerFixtures.transaction(TransactionType.SENT, "1", "0x01", "device");

        assertEquals(ledgerStore.getDeviceId(), readOnly.getDeviceId());
        assertThrows(UnsupportedOperationException.class, () -> readOnly.atomically(writer -> null));
        assertThrows(UnsupportedOperationException.class, () -> readOnly.addPendingTransaction(transaction));
        assertThrows(UnsupportedOperationException.class,
                () -> readOnly.updateOfflineBalances(OfflineBalances.ZERO));
        assertThrows(UnsupportedOperationException.class, () -> readOnly.getPendingTransactions().add(transaction));
    }

}
