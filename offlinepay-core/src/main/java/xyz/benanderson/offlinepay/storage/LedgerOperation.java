package xyz.benanderson.offlinepay.storage;

import xyz.benanderson.offlinepay.exception.OfflinePayException;

@FunctionalInterface
public interface LedgerOperation<T> {

    T apply(LedgerWriter writer) throws OfflinePayException;

}
