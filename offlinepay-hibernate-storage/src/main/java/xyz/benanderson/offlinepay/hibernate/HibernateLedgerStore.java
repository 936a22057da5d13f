package xyz.benanderson.offlinepay.hibernate;

import org.hibernate.SessionFactory;
import org.hibernate.cfg.Configuration;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.hibernate.entity.DeviceLedgerEntity;
import xyz.benanderson.offlinepay.hibernate.entity.OfflineAllowanceEntity;
import xyz.benanderson.offlinepay.hibernate.entity.PendingTransactionEntity;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.storage.LedgerOperation;
import xyz.benanderson.offlinepay.storage.LedgerStore;
import xyz.benanderson.offlinepay.util.Amounts;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps the ledger in a relational database. Each {@link #atomically} call is one database transaction, and calls
 * are serialised within this process.
 */
public class HibernateLedgerStore extends DatabaseAccessor implements LedgerStore {

    private final Object writeLock = new Object();
    private final String deviceId;

    /**
     * @param databaseConfiguration connection settings, the ledger entities are added to it
     * @throws StorageException if the device row could not be read or created
     */
    public HibernateLedgerStore(Configuration databaseConfiguration) throws StorageException {
        this(databaseConfiguration
                .addAnnotatedClass(DeviceLedgerEntity.class)
                .addAnnotatedClass(PendingTransactionEntity.class)
                .addAnnotatedClass(OfflineAllowanceEntity.class)
                .buildSessionFactory());
    }

    HibernateLedgerStore(SessionFactory databaseSessionFactory) throws StorageException {
        super(databaseSessionFactory);
        this.deviceId = loadOrCreateDeviceId();
    }

    private String loadOrCreateDeviceId() throws StorageException {
        try {
            return inTransaction(session -> {
                List<DeviceLedgerEntity> rows = session.createQuery("from DeviceLedgerEntity",
                        DeviceLedgerEntity.class).getResultList();
                if (!rows.isEmpty()) return rows.get(0).getDeviceId();
                DeviceLedgerEntity created = new DeviceLedgerEntity(UUID.randomUUID().toString(),
                        Amounts.ZERO, Amounts.ZERO);
                session.persist(created);
                OfflinePay.LOGGER.info("Created device ledger " + created.getDeviceId());
                return created.getDeviceId();
            });
        } catch (StorageException e) {
            throw e;
        } catch (OfflinePayException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    @Override
    public String getDeviceId() {
        return deviceId;
    }

    @Override
    public OfflineBalances getOfflineBalances() throws StorageException {
        return read(session -> new SessionLedgerWriter(session, deviceId).getOfflineBalances());
    }

    @Override
    public List<PendingTransaction> getPendingTransactions() throws StorageException {
        return read(session -> new SessionLedgerWriter(session, deviceId).getPendingTransactions());
    }

    @Override
    public Optional<PendingTransaction> findPendingTransaction(String id) throws StorageException {
        return read(session -> new SessionLedgerWriter(session, deviceId).findPendingTransaction(id));
    }

    @Override
    public Optional<OfflineAllowance> findAllowance(String walletAddress) throws StorageException {
        return read(session -> new SessionLedgerWriter(session, deviceId).findAllowance(walletAddress));
    }

    @Override
    public <T> T atomically(LedgerOperation<T> operation) throws OfflinePayException {
        synchronized (writeLock) {
            return inTransaction(session -> operation.apply(new SessionLedgerWriter(session, deviceId)));
        }
    }

}
