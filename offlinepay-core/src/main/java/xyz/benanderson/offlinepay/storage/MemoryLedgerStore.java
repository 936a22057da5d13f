package xyz.benanderson.offlinepay.storage;

import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the ledger in memory, so it is lost when the process exits. Operations run against a copy of the state
 * which replaces the live state only if they return normally. Reads never block.
 */
public class MemoryLedgerStore implements LedgerStore {

    private final Object writeLock = new Object();
    private volatile LedgerSnapshot state;

    public MemoryLedgerStore() {
        this(LedgerSnapshot.empty());
    }

    MemoryLedgerStore(LedgerSnapshot state) {
        this.state = state;
    }

    @Override
    public String getDeviceId() {
        return state.getDeviceId();
    }

    @Override
    public OfflineBalances getOfflineBalances() {
        return state.getOfflineBalances();
    }

    @Override
    public List<PendingTransaction> getPendingTransactions() {
        return state.getPendingTransactions();
    }

    @Override
    public Optional<PendingTransaction> findPendingTransaction(String id) {
        return state.findPendingTransaction(id);
    }

    @Override
    public Optional<OfflineAllowance> findAllowance(String walletAddress) {
        return state.findAllowance(walletAddress);
    }

    @Override
    public <T> T atomically(LedgerOperation<T> operation) throws OfflinePayException {
        synchronized (writeLock) {
            LedgerSnapshot working = state.copy();
            T result = operation.apply(working);
            state = working;
            return result;
        }
    }

}
