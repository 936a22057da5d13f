package xyz.benanderson.offlinepay.storage;

import lombok.Getter;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Whole-ledger state held in memory. Not thread-safe, stores guard it and hand out {@link #copy()}s to
 * operations. The field layout is also the single-file storage format.
 */
class LedgerSnapshot implements LedgerWriter {

    @Getter
    private final String deviceId;
    private OfflineBalances offlineBalances;
    private final LinkedHashMap<String, PendingTransaction> transactions;
    private final LinkedHashMap<String, OfflineAllowance> allowances;

    private LedgerSnapshot(String deviceId, OfflineBalances offlineBalances,
                           Map<String, PendingTransaction> transactions, Map<String, OfflineAllowance> allowances) {
        this.deviceId = deviceId;
        this.offlineBalances = offlineBalances;
        this.transactions = new LinkedHashMap<>(transactions);
        this.allowances = new LinkedHashMap<>(allowances);
    }

    static LedgerSnapshot empty() {
        return new LedgerSnapshot(UUID.randomUUID().toString(), OfflineBalances.ZERO, Map.of(), Map.of());
    }

    LedgerSnapshot copy() {
        return new LedgerSnapshot(deviceId, offlineBalances, transactions, allowances);
    }

    /**
     * @return whether every field survived deserialization
     */
    boolean isComplete() {
        return deviceId != null && offlineBalances != null && transactions != null && allowances != null;
    }

    @Override
    public OfflineBalances getOfflineBalances() {
        return offlineBalances;
    }

    @Override
    public void updateOfflineBalances(OfflineBalances balances) {
        this.offlineBalances = balances;
    }

    @Override
    public void addPendingTransaction(PendingTransaction transaction) throws StorageException {
        if (transactions.containsKey(transaction.id()))
            throw new StorageException("Transaction " + transaction.id() + " is already recorded");
        transactions.put(transaction.id(), transaction);
    }

    @Override
    public void updatePendingTransaction(PendingTransaction transaction) throws StorageException {
        if (!transactions.containsKey(transaction.id()))
            throw new StorageException("Transaction " + transaction.id() + " is not recorded");
        transactions.put(transaction.id(), transaction);
    }

    @Override
    public Optional<PendingTransaction> findPendingTransaction(String id) {
        return Optional.ofNullable(transactions.get(id));
    }

    @Override
    public Optional<PendingTransaction> findByEphemeralAddress(String ephemeralAddress, TransactionType type) {
        return transactions.values().stream()
                .filter(transaction -> transaction.type() == type)
                .filter(transaction -> transaction.ephemeralAddress().equalsIgnoreCase(ephemeralAddress))
                .findFirst();
    }

    @Override
    public List<PendingTransaction> getPendingTransactions() {
        return List.copyOf(transactions.values());
    }

    @Override
    public Optional<OfflineAllowance> findAllowance(String walletAddress) {
        return Optional.ofNullable(allowances.get(OfflineAllowance.key(walletAddress)));
    }

    @Override
    public void saveAllowance(OfflineAllowance allowance) {
        allowances.put(OfflineAllowance.key(allowance.walletAddress()), allowance);
    }

}
