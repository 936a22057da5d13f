package xyz.benanderson.offlinepay.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientBalanceException extends OfflinePayException {

    private final BigDecimal requested, available;

    public InsufficientBalanceException(BigDecimal requested, BigDecimal available) {
        super("Available balance is " + available.toPlainString() + ", " + requested.toPlainString() + " requested");
        this.requested = requested;
        this.available = available;
    }

}
