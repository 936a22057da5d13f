package xyz.benanderson.offlinepay.scan;

import xyz.benanderson.offlinepay.exception.OfflinePayException;

/**
 * Processes one decoded string. Returning normally means any ledger work it did has been committed.
 */
@FunctionalInterface
public interface ScanHandler<T> {

    T handle(String decoded) throws OfflinePayException;

}
