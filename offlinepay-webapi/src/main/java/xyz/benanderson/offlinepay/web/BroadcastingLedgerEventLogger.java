package xyz.benanderson.offlinepay.web;

import lombok.AllArgsConstructor;
import xyz.benanderson.offlinepay.ledger.LedgerEventLogger;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;

import java.util.function.Consumer;

/**
 * Logs through {@code delegate}, then hands the transaction to the websocket broadcaster.
 */
@AllArgsConstructor
public class BroadcastingLedgerEventLogger implements LedgerEventLogger {

    private final LedgerEventLogger delegate;
    private final Consumer<PendingTransaction> broadcaster;

    @Override
    public void log(PendingTransaction transaction) {
        delegate.log(transaction);
        broadcaster.accept(transaction);
    }

}
