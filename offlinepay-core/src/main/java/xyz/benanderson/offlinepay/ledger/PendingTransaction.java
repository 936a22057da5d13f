package xyz.benanderson.offlinepay.ledger;

import com.google.gson.annotations.JsonAdapter;
import org.jetbrains.annotations.Nullable;
import xyz.benanderson.offlinepay.util.Amounts;
import xyz.benanderson.offlinepay.voucher.Voucher;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.UUID;

/**
 * A ledger record of one issued or redeemed voucher. Records are never deleted; only the settlement process
 * changes {@code status} and {@code txHash}.
 *
 * @param ephemeralAddress lower-cased address of the voucher's one-time key, which identifies the voucher however
 *                         its signature is encoded
 */
@JsonAdapter(value = PendingTransactionGsonAdapter.class)
public record PendingTransaction(String id, TransactionType type, String from, String to, BigDecimal amount,
                                 Voucher voucher, String ephemeralAddress, Instant timestamp,
                                 TransactionStatus status, String deviceId, @Nullable String txHash) {

    public PendingTransaction {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Transaction id cannot be empty");
        if (type == null || status == null || voucher == null)
            throw new IllegalArgumentException("Transaction type, status and voucher are required");
        if (ephemeralAddress == null || ephemeralAddress.isBlank())
            throw new IllegalArgumentException("Ephemeral address cannot be empty");
        ephemeralAddress = ephemeralAddress.toLowerCase(Locale.ROOT);
        amount = Amounts.requirePositive(amount);
        timestamp = timestamp.truncatedTo(ChronoUnit.MILLIS);
    }

    public static PendingTransaction of(TransactionType type, Voucher voucher, String ephemeralAddress,
                                        Instant timestamp, String deviceId) {
        return new PendingTransaction(UUID.randomUUID().toString(), type, voucher.from(), voucher.to(),
                voucher.amountValue(), voucher, ephemeralAddress, timestamp, TransactionStatus.PENDING, deviceId,
                null);
    }

    public PendingTransaction withStatus(TransactionStatus status, @Nullable String txHash) {
        return new PendingTransaction(id, type, from, to, amount, voucher, ephemeralAddress, timestamp, status,
                deviceId, txHash == null ? this.txHash : txHash);
    }

}
