package xyz.benanderson.offlinepay.ledger;

import xyz.benanderson.offlinepay.util.Amounts;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Ceiling on the value a wallet may issue while offline. Wallet addresses are compared case-insensitively, use
 * {@link #key(String)} when indexing.
 */
public record OfflineAllowance(String walletAddress, BigDecimal limit, BigDecimal spent) {

    public OfflineAllowance {
        if (walletAddress == null || walletAddress.isBlank())
            throw new IllegalArgumentException("Allowance needs a wallet address");
        if (limit.signum() < 0 || spent.signum() < 0)
            throw new IllegalArgumentException("Allowance limit and spent cannot be negative");
        limit = Amounts.normalize(limit);
        spent = Amounts.normalize(spent);
    }

    public static String key(String walletAddress) {
        return walletAddress.trim().toLowerCase(Locale.ROOT);
    }

    public BigDecimal available() {
        return Amounts.max(Amounts.ZERO, limit.subtract(spent));
    }

    public OfflineAllowance withSpent(BigDecimal spent) {
        return new OfflineAllowance(walletAddress, limit, spent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OfflineAllowance allowance = (OfflineAllowance) o;
        return key(walletAddress).equals(key(allowance.walletAddress))
                && limit.compareTo(allowance.limit) == 0
                && spent.compareTo(allowance.spent) == 0;
    }

    @Override
    public int hashCode() {
        return key(walletAddress).hashCode();
    }

}
