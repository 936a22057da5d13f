package xyz.benanderson.offlinepay;

import lombok.Getter;
import lombok.SneakyThrows;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.benanderson.offlinepay.crypto.CryptoProvider;
import xyz.benanderson.offlinepay.crypto.Web3jCryptoProvider;
import xyz.benanderson.offlinepay.exception.InsufficientBalanceException;
import xyz.benanderson.offlinepay.exception.InvalidVoucherException;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.exception.ValidationException;
import xyz.benanderson.offlinepay.ledger.AllowanceGuard;
import xyz.benanderson.offlinepay.ledger.DefaultLedgerEventLogger;
import xyz.benanderson.offlinepay.ledger.LedgerEventLogger;
import xyz.benanderson.offlinepay.ledger.LocalLedger;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.scan.CodeRenderer;
import xyz.benanderson.offlinepay.scan.ScanEvent;
import xyz.benanderson.offlinepay.scan.ScanIngestion;
import xyz.benanderson.offlinepay.scan.ScanMode;
import xyz.benanderson.offlinepay.storage.LedgerStore;
import xyz.benanderson.offlinepay.storage.MemoryLedgerStore;
import xyz.benanderson.offlinepay.storage.ReadOnlyLedgerStore;
import xyz.benanderson.offlinepay.util.Amounts;
import xyz.benanderson.offlinepay.voucher.VerificationResult;
import xyz.benanderson.offlinepay.voucher.Voucher;
import xyz.benanderson.offlinepay.voucher.VoucherCodec;
import xyz.benanderson.offlinepay.voucher.VoucherIssuer;
import xyz.benanderson.offlinepay.voucher.VoucherVerifier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Entry point for one device: issues vouchers against the offline allowance, redeems scanned vouchers into the
 * local ledger, and exposes the settlement hooks through {@link #getLedger()} and {@link #getAllowanceGuard()}.
 */
public final class OfflinePay {

    public static final Logger LOGGER = LoggerFactory.getLogger(OfflinePay.class);

    private final LedgerStore ledgerStore;
    @Getter
    private final CryptoProvider cryptoProvider;
    @Getter
    private final VoucherIssuer voucherIssuer;
    @Getter
    private final VoucherVerifier voucherVerifier;
    @Getter
    private final LocalLedger ledger;
    @Getter
    private final AllowanceGuard allowanceGuard;
    @Nullable
    private final CodeRenderer codeRenderer;

    private OfflinePay(OfflinePay.Builder builder) {
        this.ledgerStore = builder.ledgerStore;
        this.cryptoProvider = builder.cryptoProvider;
        this.codeRenderer = builder.codeRenderer;
        this.voucherIssuer = new VoucherIssuer(cryptoProvider, builder.clock);
        this.voucherVerifier = new VoucherVerifier(cryptoProvider, builder.clock, builder.voucherValidity);
        this.ledger = new LocalLedger(ledgerStore, cryptoProvider, builder.clock, builder.ledgerEventLogger);
        this.allowanceGuard = new AllowanceGuard(ledgerStore, builder.defaultAllowanceLimit);
    }

    /**
     * Issues a voucher without checking the on-chain balance, see {@link #sendOffline(String, String, BigDecimal,
     * BigDecimal)}.
     */
    public Voucher sendOffline(String senderPrivateKey, String toAddress, BigDecimal amount)
            throws OfflinePayException {
        return sendOffline(senderPrivateKey, toAddress, amount, null);
    }

    /**
     * Signs a voucher, then in one atomic ledger operation reserves the sender's offline allowance and records the
     * voucher as sent. If any part fails nothing is recorded and the voucher must be discarded.
     *
     * @param onChainBalance last known on-chain balance of the sender, or {@code null} to skip the balance check
     * @throws ValidationException if the amount, recipient or key is unusable
     * @throws InsufficientBalanceException if the amount exceeds the on-chain balance less the offline sent total
     * @throws xyz.benanderson.offlinepay.exception.InsufficientAllowanceException if the amount exceeds what is left
     * of the sender's offline allowance
     * @throws StorageException if the ledger could not be updated
     */
    public Voucher sendOffline(String senderPrivateKey, String toAddress, BigDecimal amount,
                               @Nullable BigDecimal onChainBalance) throws OfflinePayException {
        Voucher voucher = voucherIssuer.create(senderPrivateKey, toAddress, amount);
        BigDecimal value = voucher.amountValue();
        PendingTransaction transaction = ledgerStore.atomically(writer -> {
            if (onChainBalance != null) {
                BigDecimal available = ledger.getAvailableBalance(writer, onChainBalance);
                if (value.compareTo(available) > 0) throw new InsufficientBalanceException(value, available);
            }
            allowanceGuard.reserve(writer, voucher.from(), value);
            return ledger.recordSent(writer, voucher);
        });
        ledger.getLedgerEventLogger().log(transaction);
        return voucher;
    }

    /**
     * Decodes, verifies and records a scanned voucher.
     *
     * @throws xyz.benanderson.offlinepay.exception.MalformedVoucherException if the text is not a voucher
     * @throws InvalidVoucherException if verification fails or the voucher was already redeemed on this device
     */
    public PendingTransaction receiveVoucher(String decoded, String receiverAddress) throws OfflinePayException {
        return receiveVoucher(VoucherCodec.decodeVoucher(decoded), receiverAddress);
    }

    public PendingTransaction receiveVoucher(Voucher voucher, String receiverAddress) throws OfflinePayException {
        VerificationResult result = voucherVerifier.verify(voucher, receiverAddress);
        if (!result.valid()) throw new InvalidVoucherException(result.failure());
        PendingTransaction transaction = ledgerStore.atomically(writer -> ledger.recordReceived(writer, voucher));
        ledger.getLedgerEventLogger().log(transaction);
        return transaction;
    }

    /**
     * Opens a session that redeems every distinct voucher scanned for {@code receiverAddress}.
     */
    public ScanIngestion<PendingTransaction> openReceiveSession(String receiverAddress, ScanMode mode,
                                                                Consumer<ScanEvent<PendingTransaction>> listener) {
        return new ScanIngestion<>(mode, decoded -> receiveVoucher(decoded, receiverAddress), listener);
    }

    /**
     * Opens a session that scans a receiving address and issues one voucher of {@code amount} to it. The encoded
     * voucher is shown on the configured {@link CodeRenderer}, if any.
     */
    public ScanIngestion<Voucher> openSendSession(String senderPrivateKey, BigDecimal amount,
                                                  @Nullable BigDecimal onChainBalance,
                                                  Consumer<ScanEvent<Voucher>> listener) {
        return new ScanIngestion<>(ScanMode.SINGLE, decoded -> {
            Voucher voucher = sendOffline(senderPrivateKey, VoucherCodec.decodeAddress(decoded), amount,
                    onChainBalance);
            displayVoucher(voucher);
            return voucher;
        }, listener);
    }

    /**
     * @return the encoded voucher, after showing it on the configured {@link CodeRenderer}
     */
    public String displayVoucher(Voucher voucher) {
        String payload = VoucherCodec.encodeVoucher(voucher);
        if (codeRenderer != null) codeRenderer.render(payload);
        return payload;
    }

    /**
     * @return the address payload for {@code address}, after showing it on the configured {@link CodeRenderer}
     */
    public String displayReceivingAddress(String address) throws ValidationException {
        if (!VoucherCodec.isValidAddress(address)) throw new ValidationException("Invalid address: " + address);
        String payload = VoucherCodec.encodeAddress(address);
        if (codeRenderer != null) codeRenderer.render(payload);
        return payload;
    }

    public OfflineBalances getOfflineBalances() throws StorageException {
        return ledger.getOfflineBalances();
    }

    public BigDecimal getAvailableBalance(BigDecimal onChainBalance) throws StorageException {
        return ledger.getAvailableBalance(onChainBalance);
    }

    /**
     * @return A read only view of the {@link LedgerStore} used by this object. Every write throws an
     * {@link UnsupportedOperationException}.
     */
    public LedgerStore getLedgerStore() {
        return new ReadOnlyLedgerStore(ledgerStore);
    }

    /**
     * Builder class used to construct an OfflinePay object
     */
    public static class Builder {

        private LedgerStore ledgerStore;
        private CryptoProvider cryptoProvider;
        private LedgerEventLogger ledgerEventLogger;
        private CodeRenderer codeRenderer;
        private Clock clock = Clock.systemUTC();
        private Duration voucherValidity = VoucherVerifier.DEFAULT_VALIDITY;
        private BigDecimal defaultAllowanceLimit = Amounts.ZERO;

        public Builder setLedgerStore(LedgerStore ledgerStore) {
            this.ledgerStore = ledgerStore;
            return this;
        }

        public Builder setCryptoProvider(CryptoProvider cryptoProvider) {
            this.cryptoProvider = cryptoProvider;
            return this;
        }

        public Builder setLedgerEventLogger(LedgerEventLogger ledgerEventLogger) {
            this.ledgerEventLogger = ledgerEventLogger;
            return this;
        }

        public Builder setCodeRenderer(CodeRenderer codeRenderer) {
            this.codeRenderer = codeRenderer;
            return this;
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @param voucherValidity how long after issue a voucher can still be redeemed, seven days by default
         */
        public Builder setVoucherValidity(Duration voucherValidity) {
            if (voucherValidity.isNegative() || voucherValidity.isZero())
                throw new IllegalArgumentException("Voucher validity must be positive");
            this.voucherValidity = voucherValidity;
            return this;
        }

        /**
         * @param defaultAllowanceLimit offline allowance of a wallet that has never been reset, zero by default
         */
        public Builder setDefaultAllowanceLimit(BigDecimal defaultAllowanceLimit) {
            this.defaultAllowanceLimit = Amounts.normalize(defaultAllowanceLimit);
            return this;
        }

        @SneakyThrows
        public OfflinePay build() {
            if (ledgerStore == null) ledgerStore = new MemoryLedgerStore();
            if (cryptoProvider == null) cryptoProvider = new Web3jCryptoProvider();
            if (ledgerEventLogger == null) ledgerEventLogger = new DefaultLedgerEventLogger();
            return new OfflinePay(this);
        }

    }

}
