package xyz.benanderson.offlinepay.ledger;

import xyz.benanderson.offlinepay.util.Amounts;

import java.math.BigDecimal;

/**
 * Cumulative value sent and received by this device while offline.
 */
public record OfflineBalances(BigDecimal sent, BigDecimal received) {

    public static final OfflineBalances ZERO = new OfflineBalances(Amounts.ZERO, Amounts.ZERO);

    public OfflineBalances {
        if (sent.signum() < 0 || received.signum() < 0)
            throw new IllegalArgumentException("Offline balances cannot be negative");
        sent = Amounts.normalize(sent);
        received = Amounts.normalize(received);
    }

    public OfflineBalances plus(TransactionType type, BigDecimal amount) {
        return type == TransactionType.SENT
                ? new OfflineBalances(sent.add(amount), received)
                : new OfflineBalances(sent, received.add(amount));
    }

}
