package xyz.benanderson.offlinepay.storage;

import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionType;

import java.util.List;
import java.util.Optional;

/**
 * View of the ledger handed to a {@link LedgerOperation}. Writes made through it become visible together when the
 * operation returns, and are discarded if it throws.
 */
public interface LedgerWriter {

    String getDeviceId();

    OfflineBalances getOfflineBalances();

    void updateOfflineBalances(OfflineBalances balances);

    /**
     * @throws StorageException if a transaction with the same id is already recorded
     */
    void addPendingTransaction(PendingTransaction transaction) throws StorageException;

    /**
     * @throws StorageException if no transaction with the same id is recorded
     */
    void updatePendingTransaction(PendingTransaction transaction) throws StorageException;

    Optional<PendingTransaction> findPendingTransaction(String id);

    /**
     * Looks a voucher up by the address of its one-time key, ignoring case.
     */
    Optional<PendingTransaction> findByEphemeralAddress(String ephemeralAddress, TransactionType type);

    List<PendingTransaction> getPendingTransactions();

    Optional<OfflineAllowance> findAllowance(String walletAddress);

    void saveAllowance(OfflineAllowance allowance);

}
