package xyz.benanderson.offlinepay.exception;

/**
 * Thrown when the ledger store could not durably apply or read state. When raised from an atomic operation, none
 * of that operation's writes are visible afterwards.
 */
public class StorageException extends OfflinePayException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

}
