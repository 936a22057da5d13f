package xyz.benanderson.offlinepay.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientAllowanceException extends OfflinePayException {

    private final BigDecimal requested, available;

    public InsufficientAllowanceException(String walletAddress, BigDecimal requested, BigDecimal available) {
        super("Offline allowance of " + walletAddress + " has " + available.toPlainString()
                + " available, " + requested.toPlainString() + " requested");
        this.requested = requested;
        this.available = available;
    }

}
