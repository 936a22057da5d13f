package xyz.benanderson.offlinepay.voucher;

import com.google.gson.annotations.JsonAdapter;
import xyz.benanderson.offlinepay.util.Amounts;

import java.math.BigDecimal;

/**
 * A signed bearer claim. Whoever holds {@code ephemeralPrivateKey} holds the value, so the key is kept out of
 * {@link #toString()} and must never be logged.
 *
 * @param version wire format version, only {@link #CURRENT_VERSION} is accepted
 * @param ephemeralPrivateKey secret key of the single-use wallet carrying the value
 * @param amount positive decimal text with at most six fractional digits
 * @param from address of the issuing wallet
 * @param to address of the intended recipient
 * @param timestamp creation time in milliseconds since the epoch
 * @param signature sender's signature over the canonical message, see {@link VoucherCodec#signingMessage}
 */
@JsonAdapter(value = VoucherGsonAdapter.class)
public record Voucher(int version, String ephemeralPrivateKey, String amount, String from, String to,
                      long timestamp, String signature) {

    public static final int CURRENT_VERSION = 1;

    public Voucher {
        if (version != CURRENT_VERSION)
            throw new IllegalArgumentException("Unsupported voucher version " + version);
        requireText(ephemeralPrivateKey, "privateKey");
        requireText(from, "from");
        requireText(to, "to");
        requireText(signature, "signature");
        requireText(amount, "amount");
        Amounts.parsePositive(amount);
        if (timestamp <= 0)
            throw new IllegalArgumentException("Voucher timestamp must be positive");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException("Voucher field '" + field + "' is missing");
    }

    public BigDecimal amountValue() {
        return Amounts.parsePositive(amount);
    }

    @Override
    public String toString() {
        return "Voucher[version=" + version + ", amount=" + amount + ", from=" + from + ", to=" + to
                + ", timestamp=" + timestamp + ", signature=" + signature + "]";
    }

}
