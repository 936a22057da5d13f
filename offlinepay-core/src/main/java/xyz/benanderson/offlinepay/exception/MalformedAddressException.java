package xyz.benanderson.offlinepay.exception;

public class MalformedAddressException extends OfflinePayException {

    public MalformedAddressException(String message) {
        super(message);
    }

}
