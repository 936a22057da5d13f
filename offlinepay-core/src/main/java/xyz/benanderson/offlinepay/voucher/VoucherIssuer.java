package xyz.benanderson.offlinepay.voucher;

import lombok.AllArgsConstructor;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.crypto.CryptoProvider;
import xyz.benanderson.offlinepay.crypto.EphemeralKey;
import xyz.benanderson.offlinepay.exception.ValidationException;
import xyz.benanderson.offlinepay.util.Amounts;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Creates signed vouchers. Issuing has no ledger side effect; recording the voucher and reserving allowance is
 * the caller's job and has to happen in the same atomic ledger operation.
 */
@AllArgsConstructor
public class VoucherIssuer {

    private final CryptoProvider cryptoProvider;
    private final Clock clock;

    /**
     * @param senderPrivateKey key of the wallet the value is drawn from
     * @param toAddress address the voucher is bound to
     * @param amount value of the voucher, at most six fractional digits
     * @throws ValidationException if the amount, recipient or sender key is unusable
     */
    public Voucher create(String senderPrivateKey, String toAddress, BigDecimal amount) throws ValidationException {
        String normalizedAmount;
        try {
            normalizedAmount = Amounts.format(Amounts.requirePositive(amount));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        if (!VoucherCodec.isValidAddress(toAddress))
            throw new ValidationException("Invalid recipient address: " + toAddress);
        String from;
        try {
            from = cryptoProvider.deriveAddress(senderPrivateKey);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unusable sender key", e);
        }

        EphemeralKey ephemeralKey = cryptoProvider.generateKeypair();
        long timestamp = clock.millis();
        String message = VoucherCodec.signingMessage(from, toAddress, normalizedAmount, timestamp,
                ephemeralKey.address());
        String signature = cryptoProvider.sign(senderPrivateKey, message);

        Voucher voucher = new Voucher(Voucher.CURRENT_VERSION, ephemeralKey.privateKey(), normalizedAmount,
                from, toAddress, timestamp, signature);
        OfflinePay.LOGGER.debug("Issued voucher of " + normalizedAmount + " from " + from + " to " + toAddress);
        return voucher;
    }

}
