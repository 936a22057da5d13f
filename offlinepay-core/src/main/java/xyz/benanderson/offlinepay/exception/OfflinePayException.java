package xyz.benanderson.offlinepay.exception;

/**
 * Base type of every recoverable failure raised by the voucher and ledger operations. No subclass is fatal,
 * callers are expected to surface the message and return to an idle state.
 */
public class OfflinePayException extends Exception {

    public OfflinePayException(String message) {
        super(message);
    }

    public OfflinePayException(String message, Throwable cause) {
        super(message, cause);
    }

}
