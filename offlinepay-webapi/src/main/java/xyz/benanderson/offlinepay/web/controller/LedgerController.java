package xyz.benanderson.offlinepay.web.controller;

import io.javalin.http.Context;
import io.javalin.http.HttpCode;
import io.javalin.http.NotFoundResponse;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionStatus;
import xyz.benanderson.offlinepay.web.OfflinePayAPI;

public record LedgerController(OfflinePay offlinePay) {

    public void getBalances(Context ctx) throws OfflinePayException {
        ctx.status(HttpCode.OK).json(offlinePay.getOfflineBalances());
    }

    public void getTransactions(Context ctx) throws OfflinePayException {
        ctx.status(HttpCode.OK).json(offlinePay.getLedger().getPendingTransactions().stream()
                .map(OfflinePayAPI.ViewableTransaction::of)
                .toArray());
    }

    public void getTransaction(Context ctx) throws OfflinePayException {
        ctx.status(HttpCode.OK).json(OfflinePayAPI.ViewableTransaction.of(findTransaction(ctx)));
    }

    /**
     * Settlement update: sets the status and, if given, the settlement hash.
     */
    public void updateTransaction(Context ctx) throws OfflinePayException {
        PendingTransaction transaction = findTransaction(ctx);
        TransactionStatus status = ctx.queryParamAsClass("status", TransactionStatus.class).get();
        PendingTransaction updated = offlinePay.getLedger()
                .updateStatus(transaction.id(), status, ctx.queryParam("tx_hash"));
        ctx.status(HttpCode.OK).json(OfflinePayAPI.ViewableTransaction.of(updated));
    }

    private PendingTransaction findTransaction(Context ctx) throws OfflinePayException {
        String id = ctx.pathParam("id");
        return offlinePay.getLedger().getPendingTransaction(id)
                .orElseThrow(() -> new NotFoundResponse("transaction not found"));
    }

}
