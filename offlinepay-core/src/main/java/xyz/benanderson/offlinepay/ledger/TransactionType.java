package xyz.benanderson.offlinepay.ledger;

public enum TransactionType {
    SENT, RECEIVED
}
