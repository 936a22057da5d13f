package xyz.benanderson.offlinepay.ledger;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import xyz.benanderson.offlinepay.crypto.CryptoProvider;
import xyz.benanderson.offlinepay.exception.InvalidVoucherException;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.exception.ValidationException;
import xyz.benanderson.offlinepay.storage.LedgerStore;
import xyz.benanderson.offlinepay.storage.LedgerWriter;
import xyz.benanderson.offlinepay.util.Amounts;
import xyz.benanderson.offlinepay.voucher.VerificationFailure;
import xyz.benanderson.offlinepay.voucher.Voucher;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Pending-transaction log and cumulative offline balances of this device. The {@code record*} methods compose
 * into a caller's atomic operation; everything else runs its own.
 */
public class LocalLedger {

    private final LedgerStore ledgerStore;
    private final CryptoProvider cryptoProvider;
    private final Clock clock;
    @Getter
    private final LedgerEventLogger ledgerEventLogger;

    public LocalLedger(LedgerStore ledgerStore, CryptoProvider cryptoProvider, Clock clock,
                       LedgerEventLogger ledgerEventLogger) {
        this.ledgerStore = ledgerStore;
        this.cryptoProvider = cryptoProvider;
        this.clock = clock;
        this.ledgerEventLogger = ledgerEventLogger;
    }

    /**
     * @throws StorageException if the transaction could not be stored, including when its id is already taken.
     * Nothing is recorded in that case.
     */
    public void addPendingTransaction(@NotNull PendingTransaction transaction) throws StorageException {
        ledgerStore.addPendingTransaction(transaction);
        ledgerEventLogger.log(transaction);
    }

    public OfflineBalances getOfflineBalances() throws StorageException {
        return ledgerStore.getOfflineBalances();
    }

    /**
     * Replaces the cumulative totals. Callers deriving new totals from a prior read should do so inside
     * {@link LedgerStore#atomically} instead.
     */
    public void updateOfflineBalances(BigDecimal sent, BigDecimal received) throws StorageException {
        ledgerStore.updateOfflineBalances(new OfflineBalances(sent, received));
    }

    public String getDeviceId() throws StorageException {
        return ledgerStore.getDeviceId();
    }

    public List<PendingTransaction> getPendingTransactions() throws StorageException {
        return ledgerStore.getPendingTransactions();
    }

    public Optional<PendingTransaction> getPendingTransaction(String id) throws StorageException {
        return ledgerStore.findPendingTransaction(id);
    }

    /**
     * Appends a sent record for the voucher and adds its amount to the sent total.
     */
    public PendingTransaction recordSent(LedgerWriter writer, Voucher voucher)
            throws InvalidVoucherException, StorageException {
        return record(writer, TransactionType.SENT, voucher, ephemeralAddressOf(voucher));
    }

    /**
     * Appends a received record for the voucher and adds its amount to the received total.
     *
     * @throws InvalidVoucherException with {@link VerificationFailure#ALREADY_REDEEMED} if this device already
     * received a voucher with the same one-time key
     */
    public PendingTransaction recordReceived(LedgerWriter writer, Voucher voucher)
            throws InvalidVoucherException, StorageException {
        String ephemeralAddress = ephemeralAddressOf(voucher);
        if (writer.findByEphemeralAddress(ephemeralAddress, TransactionType.RECEIVED).isPresent())
            throw new InvalidVoucherException(VerificationFailure.ALREADY_REDEEMED);
        return record(writer, TransactionType.RECEIVED, voucher, ephemeralAddress);
    }

    // the signature has several valid encodings, the one-time key has one address
    private String ephemeralAddressOf(Voucher voucher) throws InvalidVoucherException {
        try {
            return cryptoProvider.deriveAddress(voucher.ephemeralPrivateKey());
        } catch (IllegalArgumentException e) {
            throw new InvalidVoucherException(VerificationFailure.INVALID_SIGNATURE);
        }
    }

    private PendingTransaction record(LedgerWriter writer, TransactionType type, Voucher voucher,
                                      String ephemeralAddress) throws StorageException {
        PendingTransaction transaction = PendingTransaction.of(type, voucher, ephemeralAddress, clock.instant(),
                writer.getDeviceId());
        writer.addPendingTransaction(transaction);
        writer.updateOfflineBalances(writer.getOfflineBalances().plus(type, transaction.amount()));
        return transaction;
    }

    /**
     * Settlement hook: moves a transaction to a new status, optionally recording its settlement hash.
     *
     * @throws ValidationException if no transaction has the id
     */
    public PendingTransaction updateStatus(String id, TransactionStatus status, @Nullable String txHash)
            throws OfflinePayException {
        PendingTransaction updated = ledgerStore.atomically(writer -> {
            PendingTransaction transaction = writer.findPendingTransaction(id)
                    .orElseThrow(() -> new ValidationException("No transaction with id " + id));
            PendingTransaction changed = transaction.withStatus(status, txHash);
            writer.updatePendingTransaction(changed);
            return changed;
        });
        ledgerEventLogger.log(updated);
        return updated;
    }

    /**
     * Settlement hook: rebuilds the offline totals from the transactions still pending, dropping whatever has been
     * settled or failed.
     */
    public OfflineBalances recalculateOfflineBalances() throws OfflinePayException {
        return ledgerStore.atomically(writer -> {
            OfflineBalances balances = OfflineBalances.ZERO;
            for (PendingTransaction transaction : writer.getPendingTransactions()) {
                if (transaction.status() == TransactionStatus.PENDING)
                    balances = balances.plus(transaction.type(), transaction.amount());
            }
            writer.updateOfflineBalances(balances);
            return balances;
        });
    }

    /**
     * @param onChainBalance last known on-chain balance of the device wallet
     * @return the on-chain balance less everything sent offline, never negative
     */
    public BigDecimal getAvailableBalance(BigDecimal onChainBalance) throws StorageException {
        return availableBalance(onChainBalance, getOfflineBalances());
    }

    private static BigDecimal availableBalance(BigDecimal onChainBalance, OfflineBalances balances) {
        return Amounts.max(Amounts.ZERO, Amounts.normalize(onChainBalance).subtract(balances.sent()));
    }

    public BigDecimal getAvailableBalance(LedgerWriter writer, BigDecimal onChainBalance) {
        return availableBalance(onChainBalance, writer.getOfflineBalances());
    }

}
