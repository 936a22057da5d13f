package xyz.benanderson.offlinepay.ledger;

import xyz.benanderson.offlinepay.OfflinePay;

public class DefaultLedgerEventLogger implements LedgerEventLogger {

    @Override
    public void log(PendingTransaction transaction) {
        OfflinePay.LOGGER.debug("Transaction " + transaction.id() + " (" + transaction.type() + " "
                + transaction.amount().toPlainString() + ") is " + transaction.status());
    }

}
