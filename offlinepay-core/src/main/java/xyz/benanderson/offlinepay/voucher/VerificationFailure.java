package xyz.benanderson.offlinepay.voucher;

public enum VerificationFailure {

    /** The voucher names a different recipient than the verifying device. */
    INVALID_RECIPIENT,
    /** The signature was not produced by the stated sender over the voucher's canonical message. */
    INVALID_SIGNATURE,
    /** The voucher is older than the validity window. */
    EXPIRED,
    /** This device has already recorded a voucher carrying the same one-time key. */
    ALREADY_REDEEMED

}
