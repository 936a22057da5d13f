package xyz.benanderson.offlinepay.storage;

import lombok.AllArgsConstructor;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Read access to another store. Every write, including {@link #atomically}, throws an
 * {@link UnsupportedOperationException}.
 */
@SuppressWarnings("ClassCanBeRecord")
@AllArgsConstructor
public class ReadOnlyLedgerStore implements LedgerStore {

    private final LedgerStore ledgerStore;

    @Override
    public String getDeviceId() throws StorageException {
        return ledgerStore.getDeviceId();
    }

    @Override
    public OfflineBalances getOfflineBalances() throws StorageException {
        return ledgerStore.getOfflineBalances();
    }

    @Override
    public List<PendingTransaction> getPendingTransactions() throws StorageException {
        return List.copyOf(ledgerStore.getPendingTransactions());
    }

    @Override
    public Optional<PendingTransaction> findPendingTransaction(String id) throws StorageException {
        return ledgerStore.findPendingTransaction(id);
    }

    @Override
    public Optional<OfflineAllowance> findAllowance(String walletAddress) throws StorageException {
        return ledgerStore.findAllowance(walletAddress);
    }

    @Override
    public <T> T atomically(LedgerOperation<T> operation) {
        throw new UnsupportedOperationException();
    }

}
