package xyz.benanderson.offlinepay.hibernate;

import org.hibernate.Session;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.hibernate.entity.DeviceLedgerEntity;
import xyz.benanderson.offlinepay.hibernate.entity.OfflineAllowanceEntity;
import xyz.benanderson.offlinepay.hibernate.entity.PendingTransactionEntity;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionType;
import xyz.benanderson.offlinepay.storage.LedgerWriter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ledger view over one Hibernate session. Changes are flushed when the surrounding transaction commits.
 */
class SessionLedgerWriter implements LedgerWriter {

    private final Session session;
    private final String deviceId;

    SessionLedgerWriter(Session session, String deviceId) {
        this.session = session;
        this.deviceId = deviceId;
    }

    private DeviceLedgerEntity deviceLedger() {
        DeviceLedgerEntity deviceLedger = session.get(DeviceLedgerEntity.class, deviceId);
        if (deviceLedger == null) throw new IllegalStateException("Device ledger row " + deviceId + " is missing");
        return deviceLedger;
    }

    @Override
    public String getDeviceId() {
        return deviceId;
    }

    @Override
    public OfflineBalances getOfflineBalances() {
        return deviceLedger().asOfflineBalances();
    }

    @Override
    public void updateOfflineBalances(OfflineBalances balances) {
        deviceLedger().setOfflineBalances(balances);
    }

    @Override
    public void addPendingTransaction(PendingTransaction transaction) throws StorageException {
        if (session.get(PendingTransactionEntity.class, transaction.id()) != null)
            throw new StorageException("Transaction " + transaction.id() + " is already recorded");
        Long recorded = session.createQuery("select count(t) from PendingTransactionEntity t", Long.class)
                .getSingleResult();
        session.persist(new PendingTransactionEntity(transaction, recorded + 1));
    }

    @Override
    public void updatePendingTransaction(PendingTransaction transaction) throws StorageException {
        PendingTransactionEntity entity = session.get(PendingTransactionEntity.class, transaction.id());
        if (entity == null) throw new StorageException("Transaction " + transaction.id() + " is not recorded");
        entity.setStatus(transaction.status());
        entity.setTxHash(transaction.txHash());
    }

    @Override
    public Optional<PendingTransaction> findPendingTransaction(String id) {
        return Optional.ofNullable(session.get(PendingTransactionEntity.class, id))
                .map(PendingTransactionEntity::asPendingTransaction);
    }

    @Override
    public Optional<PendingTransaction> findByEphemeralAddress(String ephemeralAddress, TransactionType type) {
        return session.createQuery("from PendingTransactionEntity t where t.ephemeralAddress = :address "
                        + "and t.type = :type order by t.insertionOrder", PendingTransactionEntity.class)
                .setParameter("address", ephemeralAddress.toLowerCase(Locale.ROOT))
                .setParameter("type", type)
                .setMaxResults(1)
                .getResultList().stream()
                .findFirst()
                .map(PendingTransactionEntity::asPendingTransaction);
    }

    @Override
    public List<PendingTransaction> getPendingTransactions() {
        return session.createQuery("from PendingTransactionEntity t order by t.insertionOrder",
                        PendingTransactionEntity.class)
                .getResultList().stream()
                .map(PendingTransactionEntity::asPendingTransaction)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public Optional<OfflineAllowance> findAllowance(String walletAddress) {
        return Optional.ofNullable(session.get(OfflineAllowanceEntity.class, OfflineAllowance.key(walletAddress)))
                .map(OfflineAllowanceEntity::asOfflineAllowance);
    }

    @Override
    public void saveAllowance(OfflineAllowance allowance) {
        OfflineAllowanceEntity entity = session.get(OfflineAllowanceEntity.class,
                OfflineAllowance.key(allowance.walletAddress()));
        if (entity == null) {
            session.persist(new OfflineAllowanceEntity(allowance));
            return;
        }
        entity.setWalletAddress(allowance.walletAddress());
        entity.setLimit(allowance.limit());
        entity.setSpent(allowance.spent());
    }

}
