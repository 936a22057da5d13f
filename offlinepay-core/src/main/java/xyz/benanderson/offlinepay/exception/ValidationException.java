package xyz.benanderson.offlinepay.exception;

/**
 * Thrown when an amount, address or key handed to an issuing operation is unusable. Always raised before any
 * state has been changed.
 */
public class ValidationException extends OfflinePayException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

}
