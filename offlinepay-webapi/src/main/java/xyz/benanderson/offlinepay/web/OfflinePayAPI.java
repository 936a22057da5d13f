package xyz.benanderson.offlinepay.web;

import io.javalin.Javalin;
import io.javalin.core.validation.JavalinValidation;
import io.javalin.http.ForbiddenResponse;
import io.javalin.websocket.WsContext;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.ledger.DefaultLedgerEventLogger;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionStatus;
import xyz.benanderson.offlinepay.scan.ScanEvent;
import xyz.benanderson.offlinepay.web.controller.AllowanceController;
import xyz.benanderson.offlinepay.web.controller.LedgerController;
import xyz.benanderson.offlinepay.web.controller.ScanController;
import xyz.benanderson.offlinepay.web.controller.WalletController;

import java.math.BigDecimal;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import static io.javalin.apibuilder.ApiBuilder.*;

public class OfflinePayAPI {

    private final Configuration config;
    @Getter
    private final OfflinePay offlinePay;
    @Getter
    private final String walletAddress;
    private final String walletPrivateKey;
    private final ConfigurationParser configurationParser;
    private final Javalin javalin;
    private final GsonJsonMapper gsonJsonMapper;
    private final Set<WsContext> websocketClients = Collections.synchronizedSet(new HashSet<>());

    public record JsonResponse(boolean success, String message) {
    }

    public record ViewableTransaction(String id, String type, String from, String to, BigDecimal amount,
                                      long timestamp, String status, String deviceId, @Nullable String txHash) {
        public static ViewableTransaction of(PendingTransaction transaction) {
            return new ViewableTransaction(transaction.id(), transaction.type().toString().toLowerCase(Locale.ROOT),
                    transaction.from(), transaction.to(), transaction.amount(),
                    transaction.timestamp().toEpochMilli(), transaction.status().toString().toLowerCase(Locale.ROOT),
                    transaction.deviceId(), transaction.txHash());
        }
    }

    public record ViewableAllowance(String walletAddress, BigDecimal limit, BigDecimal spent, BigDecimal available) {
        public static ViewableAllowance of(OfflineAllowance allowance) {
            return new ViewableAllowance(allowance.walletAddress(), allowance.limit(), allowance.spent(),
                    allowance.available());
        }
    }

    public record ScanResult(String result, @Nullable String reason, @Nullable ViewableTransaction transaction) {
        public static ScanResult of(ScanEvent<PendingTransaction> event) {
            String result = event.kind().toString().toLowerCase(Locale.ROOT);
            String reason = event.getVerificationFailure()
                    .map(failure -> failure.toString().toLowerCase(Locale.ROOT))
                    .orElse(event.failure() == null ? null : event.failure().getMessage());
            ViewableTransaction transaction = event.value() == null ? null : ViewableTransaction.of(event.value());
            return new ScanResult(result, reason, transaction);
        }
    }

    OfflinePayAPI(Configuration config) {
        this.config = config;
        this.gsonJsonMapper = new GsonJsonMapper();
        this.configurationParser = new ConfigurationParser(config);
        this.offlinePay = configurationParser.createOfflinePay(
                new BroadcastingLedgerEventLogger(new DefaultLedgerEventLogger(), this::onTransactionRecorded));
        this.walletPrivateKey = configurationParser.parseWalletPrivateKey();
        this.walletAddress = offlinePay.getCryptoProvider().deriveAddress(walletPrivateKey);
        this.javalin = Javalin.create(cfg -> cfg.jsonMapper(this.gsonJsonMapper));
        JavalinValidation.register(BigDecimal.class, BigDecimal::new);
        JavalinValidation.register(TransactionStatus.class, s -> TransactionStatus.valueOf(s.toUpperCase(Locale.ROOT)));
    }

    public static void main(String[] args) {
        OfflinePayAPI offlinePayAPI = new OfflinePayAPI(new Configuration(Paths.get(System.getProperty("user.dir"))));
        offlinePayAPI.applyAll();
        offlinePayAPI.start();
    }

    void applyAll() {
        applyAuthKeyRequirementHandler();
        applyExceptionHandlers();
        applyHandlers();
        applyEventsWebsocketHandler();
    }

    private void onTransactionRecorded(PendingTransaction transaction) {
        broadcastWebsocketMessage(gsonJsonMapper.toJsonString(ViewableTransaction.of(transaction)));
    }

    private void broadcastWebsocketMessage(String message) {
        synchronized (websocketClients) {
            websocketClients.stream().filter(ctx -> ctx.session.isOpen()).forEach(session -> session.send(message));
        }
    }

    private void start() {
        start(config.getRequiredString("api.address"), config.getRequiredInt("api.port"));
    }

    void start(String address, int port) {
        javalin.start(address, port);
        OfflinePay.LOGGER.info("Serving wallet " + walletAddress + " on " + address + ":" + javalin.port());
    }

    int port() {
        return javalin.port();
    }

    void stop() {
        javalin.stop();
    }

    private void applyHandlers() {
        WalletController walletController = new WalletController(offlinePay, walletPrivateKey, walletAddress);
        ScanController scanController = new ScanController(offlinePay, walletAddress,
                configurationParser.parseScanMode());
        LedgerController ledgerController = new LedgerController(offlinePay);
        AllowanceController allowanceController = new AllowanceController(offlinePay);

        javalin.routes(() -> {
            path("address", () -> get(walletController::getAddress));
            path("vouchers", () -> post(walletController::createVoucher));
            path("scans/receive", () -> {
                post(scanController::receive);
                delete(scanController::closeReceiveSession);
            });
            path("balances", () -> get(ledgerController::getBalances));
            path("transactions", () -> {
                get(ledgerController::getTransactions);
                path("{id}", () -> {
                    get(ledgerController::getTransaction);
                    patch(ledgerController::updateTransaction);
                });
            });
            path("allowances/{address}", () -> {
                get(allowanceController::getAllowance);
                put(allowanceController::resetAllowance);
            });
        });
    }

    private void applyExceptionHandlers() {
        javalin.exception(OfflinePayException.class, new OfflinePayExceptionHandler());
    }

    private void applyEventsWebsocketHandler() {
        javalin.ws("/events", wsConfig -> {
            if (config.getBoolean("api.require_auth_key", false)) {
                wsConfig.onMessage(ctx -> {
                    final String authKey = config.getRequiredString("api.auth_key");
                    if (ctx.message().equals(authKey)) {
                        websocketClients.add(ctx);
                    }
                });
            } else {
                wsConfig.onConnect(websocketClients::add);
            }
            wsConfig.onClose(ctx -> websocketClients.removeIf(client -> !client.session.isOpen()));
        });
    }

    private void applyAuthKeyRequirementHandler() {
        if (config.getBoolean("api.require_auth_key", false)) {
            final String requiredAuthKey = config.getRequiredString("api.auth_key");
            javalin.before(ctx -> {
                String foundAuthKey = ctx.queryParam("auth_key");
                if (foundAuthKey == null || foundAuthKey.isEmpty()) {
                    throw new ForbiddenResponse("parameter 'auth_key' must be set");
                } else if (!foundAuthKey.equals(requiredAuthKey)) {
                    throw new ForbiddenResponse("parameter 'auth_key' is invalid");
                }
            });
        }
    }

}
