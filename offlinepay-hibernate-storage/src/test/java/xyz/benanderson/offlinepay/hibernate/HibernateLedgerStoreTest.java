package xyz.benanderson.offlinepay.hibernate;

import org.hibernate.SessionFactory;
import org.hibernate.cfg.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.InsufficientAllowanceException;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.exception.ValidationException;
import xyz.benanderson.offlinepay.hibernate.entity.DeviceLedgerEntity;
import xyz.benanderson.offlinepay.hibernate.entity.OfflineAllowanceEntity;
import xyz.benanderson.offlinepay.hibernate.entity.PendingTransactionEntity;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionStatus;
import xyz.benanderson.offlinepay.ledger.TransactionType;
import xyz.benanderson.offlinepay.voucher.Voucher;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class HibernateLedgerStoreTest {

    private static final String SENDER_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final String SENDER_ADDRESS = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";
    private static final String RECEIVER_ADDRESS = "0x70997970C51812dc3A010C7d01b50e0d17dc79C8";

    SessionFactory sessionFactory;
    HibernateLedgerStore ledgerStore;

    @BeforeEach
    void setupDatabase() throws StorageException {
        java.util.logging.Logger.getLogger("org.hibernate").setLevel(Level.SEVERE);
        Configuration configuration = new Configuration()
                .addAnnotatedClass(DeviceLedgerEntity.class)
                .addAnnotatedClass(PendingTransactionEntity.class)
                .addAnnotatedClass(OfflineAllowanceEntity.class)
                .setProperty("hibernate.connection.driver_class", "org.h2.Driver")
                .setProperty("hibernate.connection.url", "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .setProperty("hibernate.hbm2ddl.auto", "create-drop")
                .setProperty("hibernate.dialect", "org.hibernate.dialect.H2Dialect");
        sessionFactory = configuration.buildSessionFactory();
        ledgerStore = new HibernateLedgerStore(sessionFactory);
    }

    @AfterEach
    void closeDatabase() {
        if (sessionFactory.isOpen()) sessionFactory.close();
    }

    private PendingTransaction transaction(TransactionType type, String amount, String ephemeralAddress) {
        Voucher voucher = new Voucher(1, "0x" + "44".repeat(32), amount, SENDER_ADDRESS, RECEIVER_ADDRESS,
                1700000000000L, "0x" + "66".repeat(65));
        return PendingTransaction.of(type, voucher, ephemeralAddress, Instant.ofEpochMilli(1700000001000L),
                ledgerStore.getDeviceId());
    }

    @Test
    void keepDeviceIdAcrossInstances() throws StorageException {
        HibernateLedgerStore reopened = new HibernateLedgerStore(sessionFactory);

        assertFalse(ledgerStore.getDeviceId().isBlank());
        assertEquals(ledgerStore.getDeviceId(), reopened.getDeviceId());
        assertEquals(OfflineBalances.ZERO, reopened.getOfflineBalances());
    }

    @Test
    void applyOperationInOneTransaction() throws OfflinePayException {
        PendingTransaction first = transaction(TransactionType.SENT, "1.5", "0x01");
        PendingTransaction second = transaction(TransactionType.RECEIVED, "2", "0x02");

        ledgerStore.atomically(writer -> {
            writer.addPendingTransaction(first);
            writer.addPendingTransaction(second);
            writer.updateOfflineBalances(new OfflineBalances(new BigDecimal("1.5"), new BigDecimal("2")));
            writer.saveAllowance(new OfflineAllowance(SENDER_ADDRESS, BigDecimal.TEN, new BigDecimal("1.5")));
            return null;
        });

        assertEquals(List.of(first, second), ledgerStore.getPendingTransactions());
        assertEquals(second, ledgerStore.findPendingTransaction(second.id()).orElseThrow());
        assertEquals(new OfflineBalances(new BigDecimal("1.5"), new BigDecimal("2")),
                ledgerStore.getOfflineBalances());
        assertEquals(new OfflineAllowance(SENDER_ADDRESS, BigDecimal.TEN, new BigDecimal("1.5")),
                ledgerStore.findAllowance(SENDER_ADDRESS.toLowerCase()).orElseThrow());
    }

    @Test
    void rollBackWhenOperationFails() {
        PendingTransaction transaction = transaction(TransactionType.SENT, "1", "0x01");

        assertThrows(ValidationException.class, () -> ledgerStore.atomically(writer -> {
            writer.addPendingTransaction(transaction);
            writer.updateOfflineBalances(new OfflineBalances(BigDecimal.ONE, BigDecimal.ZERO));
            writer.saveAllowance(new OfflineAllowance(SENDER_ADDRESS, BigDecimal.TEN, BigDecimal.ONE));
            throw new ValidationException("refused");
        }));

        assertDoesNotThrow(() -> {
            assertTrue(ledgerStore.getPendingTransactions().isEmpty());
            assertEquals(OfflineBalances.ZERO, ledgerStore.getOfflineBalances());
            assertTrue(ledgerStore.findAllowance(SENDER_ADDRESS).isEmpty());
        });
    }

    @Test
    void failAddDuplicateId() throws OfflinePayException {
        PendingTransaction transaction = transaction(TransactionType.SENT, "1", "0x01");
        ledgerStore.addPendingTransaction(transaction);

        assertThrows(StorageException.class, () -> ledgerStore.addPendingTransaction(transaction));
        assertEquals(1, ledgerStore.getPendingTransactions().size());
    }

    @Test
    void updateStoredTransaction() throws OfflinePayException {
        PendingTransaction transaction = transaction(TransactionType.RECEIVED, "3", "0x03");
        ledgerStore.addPendingTransaction(transaction);
        PendingTransaction settled = transaction.withStatus(TransactionStatus.SETTLED, "0xhash");

        ledgerStore.atomically(writer -> {
            writer.updatePendingTransaction(settled);
            return null;
        });

        assertEquals(settled, ledgerStore.findPendingTransaction(transaction.id()).orElseThrow());
    }

    @Test
    void findByEphemeralAddressCaseInsensitively() throws OfflinePayException {
        PendingTransaction transaction = transaction(TransactionType.RECEIVED, "3", "0xABCDEF");
        ledgerStore.addPendingTransaction(transaction);

        assertEquals(transaction, ledgerStore.atomically(
                writer -> writer.findByEphemeralAddress("0xabcdef", TransactionType.RECEIVED)).orElseThrow());
        assertTrue(ledgerStore.atomically(
                writer -> writer.findByEphemeralAddress("0xabcdef", TransactionType.SENT)).isEmpty());
    }

    @Test
    void failWhenDatabaseIsClosed() {
        ledgerStore.close();

        assertThrows(StorageException.class, () -> ledgerStore.getOfflineBalances());
        assertThrows(StorageException.class, () -> ledgerStore.updateOfflineBalances(OfflineBalances.ZERO));
    }

    @Test
    void issueAgainstDatabaseLedger() throws OfflinePayException {
        OfflinePay offlinePay = new OfflinePay.Builder().setLedgerStore(ledgerStore).build();
        offlinePay.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));

        offlinePay.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("40"));
        offlinePay.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("60"));
        assertThrows(InsufficientAllowanceException.class,
                () -> offlinePay.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("0.01")));

        assertEquals(2, ledgerStore.getPendingTransactions().size());
        assertEquals(0, new BigDecimal("100").compareTo(ledgerStore.getOfflineBalances().sent()));
        assertEquals(0, new BigDecimal("100").compareTo(ledgerStore.findAllowance(SENDER_ADDRESS).orElseThrow().spent()));
    }

}
