package xyz.benanderson.offlinepay.voucher;

import lombok.AllArgsConstructor;
import lombok.Getter;
import xyz.benanderson.offlinepay.crypto.CryptoProvider;

import java.security.SignatureException;
import java.time.Clock;
import java.time.Duration;

/**
 * Checks recipient binding, signature and freshness of a voucher, in that order. Never throws for a voucher that
 * decoded successfully.
 */
@AllArgsConstructor
public class VoucherVerifier {

    public static final Duration DEFAULT_VALIDITY = Duration.ofDays(7);

    private final CryptoProvider cryptoProvider;
    private final Clock clock;
    @Getter
    private final Duration validity;

    public VoucherVerifier(CryptoProvider cryptoProvider, Clock clock) {
        this(cryptoProvider, clock, DEFAULT_VALIDITY);
    }

    public VerificationResult verify(Voucher voucher, String expectedRecipient) {
        if (expectedRecipient == null || !voucher.to().equalsIgnoreCase(expectedRecipient.trim()))
            return VerificationResult.failed(VerificationFailure.INVALID_RECIPIENT);

        String ephemeralAddress;
        try {
            ephemeralAddress = cryptoProvider.deriveAddress(voucher.ephemeralPrivateKey());
        } catch (IllegalArgumentException e) {
            return VerificationResult.failed(VerificationFailure.INVALID_SIGNATURE);
        }
        String message = VoucherCodec.signingMessage(voucher.from(), voucher.to(), voucher.amount(),
                voucher.timestamp(), ephemeralAddress);
        try {
            String signer = cryptoProvider.recoverAddress(message, voucher.signature());
            if (!signer.equalsIgnoreCase(voucher.from()))
                return VerificationResult.failed(VerificationFailure.INVALID_SIGNATURE);
        } catch (SignatureException e) {
            return VerificationResult.failed(VerificationFailure.INVALID_SIGNATURE);
        }

        // exactly one validity window old is still valid
        if (voucher.timestamp() < clock.millis() - validity.toMillis())
            return VerificationResult.failed(VerificationFailure.EXPIRED);
        return VerificationResult.success();
    }

}
