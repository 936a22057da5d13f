package xyz.benanderson.offlinepay.ledger;

import lombok.Getter;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.InsufficientAllowanceException;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.exception.ValidationException;
import xyz.benanderson.offlinepay.storage.LedgerStore;
import xyz.benanderson.offlinepay.storage.LedgerWriter;
import xyz.benanderson.offlinepay.util.Amounts;
import xyz.benanderson.offlinepay.voucher.VoucherCodec;

import java.math.BigDecimal;

/**
 * Caps the value a wallet can issue while offline, independent of its on-chain balance. Wallets without a stored
 * allowance get {@code defaultLimit}.
 */
public class AllowanceGuard {

    private final LedgerStore ledgerStore;
    @Getter
    private final BigDecimal defaultLimit;

    public AllowanceGuard(LedgerStore ledgerStore, BigDecimal defaultLimit) {
        if (defaultLimit.signum() < 0) throw new IllegalArgumentException("Default limit cannot be negative");
        this.ledgerStore = ledgerStore;
        this.defaultLimit = Amounts.normalize(defaultLimit);
    }

    public OfflineAllowance getAllowance(String walletAddress) throws StorageException {
        return ledgerStore.findAllowance(walletAddress).orElseGet(() -> initial(walletAddress));
    }

    /**
     * Reserves {@code amount} of the wallet's allowance in its own atomic operation.
     *
     * @return the allowance after the reservation
     * @throws InsufficientAllowanceException if less than {@code amount} is available, nothing is reserved
     */
    public OfflineAllowance checkAndReserve(String walletAddress, BigDecimal amount) throws OfflinePayException {
        return ledgerStore.atomically(writer -> reserve(writer, walletAddress, amount));
    }

    /**
     * Same check as {@link #checkAndReserve}, composed into the caller's atomic operation.
     */
    public OfflineAllowance reserve(LedgerWriter writer, String walletAddress, BigDecimal amount)
            throws InsufficientAllowanceException, ValidationException {
        BigDecimal requested;
        try {
            requested = Amounts.requirePositive(amount);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        OfflineAllowance allowance = writer.findAllowance(walletAddress).orElseGet(() -> initial(walletAddress));
        BigDecimal available = allowance.limit().subtract(allowance.spent());
        if (requested.compareTo(available) > 0)
            throw new InsufficientAllowanceException(walletAddress, requested, Amounts.max(Amounts.ZERO, available));
        OfflineAllowance reserved = allowance.withSpent(allowance.spent().add(requested));
        writer.saveAllowance(reserved);
        return reserved;
    }

    /**
     * Settlement hook: sets a new limit and clears what has been spent.
     */
    public OfflineAllowance resetAllowance(String walletAddress, BigDecimal newLimit) throws OfflinePayException {
        if (!VoucherCodec.isValidAddress(walletAddress))
            throw new ValidationException("Invalid wallet address: " + walletAddress);
        if (newLimit == null)
            throw new ValidationException("Allowance limit is required");
        OfflineAllowance allowance;
        try {
            allowance = new OfflineAllowance(walletAddress, newLimit, Amounts.ZERO);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        ledgerStore.saveAllowance(allowance);
        OfflinePay.LOGGER.info("Offline allowance of " + walletAddress + " reset to "
                + allowance.limit().toPlainString());
        return allowance;
    }

    private OfflineAllowance initial(String walletAddress) {
        return new OfflineAllowance(walletAddress, defaultLimit, Amounts.ZERO);
    }

}
