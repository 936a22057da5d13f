package xyz.benanderson.offlinepay.web.controller;

import io.javalin.http.Context;
import io.javalin.http.HttpCode;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.scan.ScanEvent;
import xyz.benanderson.offlinepay.scan.ScanIngestion;
import xyz.benanderson.offlinepay.scan.ScanMode;
import xyz.benanderson.offlinepay.web.OfflinePayAPI;

/**
 * Feeds codes decoded by the client's camera into one receive session. The session is opened on the first scan
 * and stays open until it is deleted, so a single mode session ignores everything after its first voucher.
 */
public class ScanController {

    private final OfflinePay offlinePay;
    private final String walletAddress;
    private final ScanMode mode;
    private ScanIngestion<PendingTransaction> receiveSession;

    public ScanController(OfflinePay offlinePay, String walletAddress, ScanMode mode) {
        this.offlinePay = offlinePay;
        this.walletAddress = walletAddress;
        this.mode = mode;
    }

    private synchronized ScanIngestion<PendingTransaction> getReceiveSession() {
        if (receiveSession == null) {
            receiveSession = offlinePay.openReceiveSession(walletAddress, mode, event -> {});
        }
        return receiveSession;
    }

    public void receive(Context ctx) {
        ScanEvent<PendingTransaction> event = getReceiveSession().onDecoded(ctx.body().strip());
        ctx.status(HttpCode.OK).json(OfflinePayAPI.ScanResult.of(event));
    }

    public void closeReceiveSession(Context ctx) {
        ScanIngestion<PendingTransaction> session;
        synchronized (this) {
            session = receiveSession;
            receiveSession = null;
        }
        if (session != null) session.close();
        ctx.status(HttpCode.OK).json(new OfflinePayAPI.JsonResponse(true,
                session == null ? "no receive session open" : "receive session closed"));
    }

}
