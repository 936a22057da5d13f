package xyz.benanderson.offlinepay.exception;

public class MalformedVoucherException extends OfflinePayException {

    public MalformedVoucherException(String message) {
        super(message);
    }

    public MalformedVoucherException(String message, Throwable cause) {
        super(message, cause);
    }

}
