package xyz.benanderson.offlinepay.ledger;

/**
 * Only the settlement process moves a transaction out of {@link #PENDING}.
 */
public enum TransactionStatus {
    PENDING, SETTLED, FAILED
}
