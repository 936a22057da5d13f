package xyz.benanderson.offlinepay.ledger;

/**
 * Notified after a transaction has been durably recorded or its status changed. Called outside the atomic ledger
 * operation, so implementations cannot veto the change.
 */
public interface LedgerEventLogger {

    void log(PendingTransaction transaction);

}
