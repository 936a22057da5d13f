package xyz.benanderson.offlinepay.storage;

import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Durable ledger of one device: its id, offline balances, pending transactions and wallet allowances. All
 * {@link LedgerStore} implementations should be thread-safe, and must serialise {@link #atomically} calls so that
 * there is a single writer per device.
 */
public interface LedgerStore {

    /**
     * @return identifier generated the first time the store was initialised, stable afterwards
     */
    String getDeviceId() throws StorageException;

    OfflineBalances getOfflineBalances() throws StorageException;

    /**
     * @return every recorded transaction in insertion order. It is preferable that the list be immutable.
     */
    List<PendingTransaction> getPendingTransactions() throws StorageException;

    Optional<PendingTransaction> findPendingTransaction(String id) throws StorageException;

    Optional<OfflineAllowance> findAllowance(String walletAddress) throws StorageException;

    /**
     * Runs the operation against the ledger and applies all of its writes as one unit once it returns. If the
     * operation throws, or the writes cannot be made durable, no write is applied.
     *
     * @throws StorageException if the writes could not be applied
     * @throws OfflinePayException rethrown from the operation
     */
    <T> T atomically(LedgerOperation<T> operation) throws OfflinePayException;

    default void addPendingTransaction(PendingTransaction transaction) throws StorageException {
        runStorageOnly(writer -> {
            writer.addPendingTransaction(transaction);
            return null;
        });
    }

    default void updateOfflineBalances(OfflineBalances balances) throws StorageException {
        runStorageOnly(writer -> {
            writer.updateOfflineBalances(balances);
            return null;
        });
    }

    default void saveAllowance(OfflineAllowance allowance) throws StorageException {
        runStorageOnly(writer -> {
            writer.saveAllowance(allowance);
            return null;
        });
    }

    private void runStorageOnly(LedgerOperation<Void> operation) throws StorageException {
        try {
            atomically(operation);
        } catch (StorageException e) {
            throw e;
        } catch (OfflinePayException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

}
