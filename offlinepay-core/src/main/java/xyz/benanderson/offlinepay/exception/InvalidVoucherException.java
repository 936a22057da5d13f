package xyz.benanderson.offlinepay.exception;

import lombok.Getter;
import xyz.benanderson.offlinepay.voucher.VerificationFailure;

/**
 * Thrown when a well-formed voucher is refused by a receiving device, either because verification failed or
 * because the device has already redeemed it.
 */
@Getter
public class InvalidVoucherException extends OfflinePayException {

    private final VerificationFailure failure;

    public InvalidVoucherException(VerificationFailure failure) {
        super("Voucher rejected: " + failure);
        this.failure = failure;
    }

}
