package xyz.benanderson.offlinepay;

import org.junit.jupiter.api.Test;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;
import xyz.benanderson.offlinepay.crypto.CryptoProvider;
import xyz.benanderson.offlinepay.crypto.Web3jCryptoProvider;
import xyz.benanderson.offlinepay.exception.InsufficientAllowanceException;
import xyz.benanderson.offlinepay.exception.InsufficientBalanceException;
import xyz.benanderson.offlinepay.exception.InvalidVoucherException;
import xyz.benanderson.offlinepay.exception.MalformedVoucherException;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.ledger.LedgerEventLogger;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionStatus;
import xyz.benanderson.offlinepay.ledger.TransactionType;
import xyz.benanderson.offlinepay.scan.CodeRenderer;
import xyz.benanderson.offlinepay.scan.QrScanner;
import xyz.benanderson.offlinepay.scan.ScanEvent;
import xyz.benanderson.offlinepay.scan.ScanIngestion;
import xyz.benanderson.offlinepay.scan.ScanMode;
import xyz.benanderson.offlinepay.storage.LedgerOperation;
import xyz.benanderson.offlinepay.storage.LedgerStore;
import xyz.benanderson.offlinepay.storage.MemoryLedgerStore;
import xyz.benanderson.offlinepay.voucher.VerificationFailure;
import xyz.benanderson.offlinepay.voucher.Voucher;
import xyz.benanderson.offlinepay.voucher.VoucherCodec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static xyz.benanderson.offlinepay.CustomAssertions.assertAmountEquals;
import static xyz.benanderson.offlinepay.TestWallets.*;

class OfflinePayTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1700000000000L), ZoneOffset.UTC);
    private final CryptoProvider cryptoProvider = new Web3jCryptoProvider(new SecureRandom());

    private OfflinePay device(LedgerStore ledgerStore) {
        return new OfflinePay.Builder()
                .setLedgerStore(ledgerStore)
                .setCryptoProvider(cryptoProvider)
                .setClock(clock)
                .build();
    }

    @Test
    void sendAndReceiveOffline() throws OfflinePayException {
        OfflinePay sender = device(new MemoryLedgerStore());
        OfflinePay receiver = device(new MemoryLedgerStore());
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));

        Voucher voucher = sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("40"));
        String payload = sender.displayVoucher(voucher);

        PendingTransaction received = receiver.receiveVoucher(payload, RECEIVER_ADDRESS);

        assertEquals(TransactionType.RECEIVED, received.type());
        assertEquals(TransactionStatus.PENDING, received.status());
        assertAmountEquals("40", received.amount());
        assertAmountEquals("40", receiver.getOfflineBalances().received());
        assertEquals(List.of(received), receiver.getLedgerStore().getPendingTransactions());

        OfflineAllowance allowance = sender.getAllowanceGuard().getAllowance(SENDER_ADDRESS);
        assertAmountEquals("100", allowance.limit());
        assertAmountEquals("40", allowance.spent());
        assertAmountEquals("40", sender.getOfflineBalances().sent());
        assertEquals(TransactionType.SENT, sender.getLedger().getPendingTransactions().get(0).type());
    }

    @Test
    void ingestSameScanOnce() throws OfflinePayException {
        OfflinePay sender = device(new MemoryLedgerStore());
        OfflinePay receiver = device(new MemoryLedgerStore());
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));
        String payload = VoucherCodec.encodeVoucher(
                sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("40")));
        List<ScanEvent<PendingTransaction>> events = new ArrayList<>();

        ScanIngestion<PendingTransaction> session = receiver.openReceiveSession(RECEIVER_ADDRESS,
                ScanMode.CONTINUOUS, events::add);
        session.onDecoded(payload);
        session.onDecoded(payload);

        assertEquals(1, events.size());
        assertEquals(1, receiver.getLedger().getPendingTransactions().size());
        assertAmountEquals("40", receiver.getOfflineBalances().received());
    }

    @Test
    void rejectRedeemingSameVoucherAcrossSessions() throws OfflinePayException {
        OfflinePay sender = device(new MemoryLedgerStore());
        OfflinePay receiver = device(new MemoryLedgerStore());
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));
        String payload = VoucherCodec.encodeVoucher(
                sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("40")));

        receiver.openReceiveSession(RECEIVER_ADDRESS, ScanMode.SINGLE, event -> {}).onDecoded(payload);
        ScanEvent<PendingTransaction> second = receiver.openReceiveSession(RECEIVER_ADDRESS, ScanMode.SINGLE,
                event -> {}).onDecoded(payload);

        assertEquals(ScanEvent.Kind.REJECTED, second.kind());
        assertEquals(VerificationFailure.ALREADY_REDEEMED, second.getVerificationFailure().orElseThrow());
        assertAmountEquals("40", receiver.getOfflineBalances().received());
    }

    @Test
    void leaveLedgerUntouchedOnVerificationFailure() throws OfflinePayException {
        OfflinePay sender = device(new MemoryLedgerStore());
        OfflinePay receiver = device(new MemoryLedgerStore());
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));
        Voucher voucher = sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("40"));

        InvalidVoucherException exception = assertThrows(InvalidVoucherException.class,
                () -> receiver.receiveVoucher(voucher, OTHER_ADDRESS));

        assertEquals(VerificationFailure.INVALID_RECIPIENT, exception.getFailure());
        assertEquals(OfflineBalances.ZERO, receiver.getOfflineBalances());
        assertTrue(receiver.getLedger().getPendingTransactions().isEmpty());
        assertThrows(MalformedVoucherException.class, () -> receiver.receiveVoucher("garbage", RECEIVER_ADDRESS));
    }

    @Test
    void rejectVoucherOutsideConfiguredValidity() throws OfflinePayException {
        OfflinePay sender = device(new MemoryLedgerStore());
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, BigDecimal.TEN);
        Voucher voucher = sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, BigDecimal.ONE);
        OfflinePay receiver = new OfflinePay.Builder()
                .setCryptoProvider(cryptoProvider)
                .setClock(Clock.offset(clock, Duration.ofMinutes(31)))
                .setVoucherValidity(Duration.ofMinutes(30))
                .build();

        InvalidVoucherException exception = assertThrows(InvalidVoucherException.class,
                () -> receiver.receiveVoucher(voucher, RECEIVER_ADDRESS));
        assertEquals(VerificationFailure.EXPIRED, exception.getFailure());
    }

    @Test
    void refuseIssuingBeyondAllowance() throws OfflinePayException {
        MemoryLedgerStore ledgerStore = new MemoryLedgerStore();
        OfflinePay sender = device(ledgerStore);
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));

        sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("40"));
        sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("60"));
        assertThrows(InsufficientAllowanceException.class,
                () -> sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("0.01")));

        assertEquals(2, ledgerStore.getPendingTransactions().size());
        assertAmountEquals("100", ledgerStore.getOfflineBalances().sent());
    }

    @Test
    void refuseIssuingWithoutAllowanceByDefault() {
        OfflinePay sender = device(new MemoryLedgerStore());
        assertThrows(InsufficientAllowanceException.class,
                () -> sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, BigDecimal.ONE));
    }

    @Test
    void useConfiguredDefaultAllowance() throws OfflinePayException {
        OfflinePay sender = new OfflinePay.Builder()
                .setCryptoProvider(cryptoProvider)
                .setDefaultAllowanceLimit(new BigDecimal("5"))
                .build();

        sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("5"));

        assertAmountEquals("0", sender.getAllowanceGuard().getAllowance(SENDER_ADDRESS).available());
    }

    @Test
    void refuseIssuingBeyondAvailableBalance() throws OfflinePayException {
        MemoryLedgerStore ledgerStore = new MemoryLedgerStore();
        OfflinePay sender = device(ledgerStore);
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));
        sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("15"), new BigDecimal("20"));

        InsufficientBalanceException exception = assertThrows(InsufficientBalanceException.class,
                () -> sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("6"), new BigDecimal("20")));

        assertAmountEquals("5", exception.getAvailable());
        assertAmountEquals("5", sender.getAvailableBalance(new BigDecimal("20")));
        assertAmountEquals("15", sender.getAllowanceGuard().getAllowance(SENDER_ADDRESS).spent());
    }

    @Test
    void rollBackIssuanceWhenLedgerWriteFails() throws OfflinePayException {
        MemoryLedgerStore ledgerStore = spy(new MemoryLedgerStore());
        OfflinePay sender = device(ledgerStore);
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));
        doAnswer(invocation -> {
            LedgerOperation<?> operation = invocation.getArgument(0);
            return ledgerStore.atomically(writer -> {
                operation.apply(writer);
                throw new StorageException("disk full");
            });
        }).doCallRealMethod().when(ledgerStore).atomically(any());

        assertThrows(StorageException.class,
                () -> sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("40")));

        assertAmountEquals("0", sender.getAllowanceGuard().getAllowance(SENDER_ADDRESS).spent());
        assertEquals(OfflineBalances.ZERO, sender.getOfflineBalances());
        assertTrue(ledgerStore.getPendingTransactions().isEmpty());
    }

    @Test
    void rejectRedeemingReencodedSignature() throws OfflinePayException {
        OfflinePay sender = device(new MemoryLedgerStore());
        OfflinePay receiver = device(new MemoryLedgerStore());
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));
        Voucher voucher = sender.sendOffline(SENDER_KEY, RECEIVER_ADDRESS, new BigDecimal("40"));
        receiver.receiveVoucher(VoucherCodec.encodeVoucher(voucher), RECEIVER_ADDRESS);

        String signature0x = voucher.signature();
        List<String> reencodings = List.of(signature0x.substring(2), shiftedRecoveryId(signature0x),
                bareSignature(signature0x), highSSignature(signature0x));
        for (String signature : reencodings) {
            Voucher reencoded = new Voucher(voucher.version(), voucher.ephemeralPrivateKey(), voucher.amount(),
                    voucher.from(), voucher.to(), voucher.timestamp(), signature);
            assertTrue(receiver.getVoucherVerifier().verify(reencoded, RECEIVER_ADDRESS).valid());
            InvalidVoucherException exception = assertThrows(InvalidVoucherException.class,
                    () -> receiver.receiveVoucher(VoucherCodec.encodeVoucher(reencoded), RECEIVER_ADDRESS));
            assertEquals(VerificationFailure.ALREADY_REDEEMED, exception.getFailure());
        }
        assertEquals(1, receiver.getLedger().getPendingTransactions().size());
        assertAmountEquals("40", receiver.getOfflineBalances().received());
    }

    private static String shiftedRecoveryId(String signature) {
        byte[] bytes = Numeric.hexStringToByteArray(signature);
        bytes[64] -= 27;
        return Numeric.toHexString(bytes);
    }

    // no 0x prefix, recovery id 0/1 instead of 27/28, upper-case hex
    private static String bareSignature(String signature) {
        byte[] bytes = Numeric.hexStringToByteArray(signature);
        bytes[64] -= 27;
        return Numeric.toHexStringNoPrefix(bytes).toUpperCase(Locale.ROOT);
    }

    // s replaced by n - s with the recovery id flipped, recovers the same signer
    private static String highSSignature(String signature) {
        byte[] bytes = Numeric.hexStringToByteArray(signature);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(bytes, 32, 64));
        byte[] highS = Numeric.toBytesPadded(Sign.CURVE_PARAMS.getN().subtract(s), 32);
        System.arraycopy(highS, 0, bytes, 32, 32);
        bytes[64] = (byte) (bytes[64] == 27 ? 28 : 27);
        return Numeric.toHexString(bytes);
    }

    @Test
    void sendSessionReopenedIssuesToSameAddressAgain() throws OfflinePayException {
        OfflinePay sender = device(new MemoryLedgerStore());
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));
        String addressPayload = sender.displayReceivingAddress(RECEIVER_ADDRESS);
        ScanIngestion<Voucher> session = sender.openSendSession(SENDER_KEY, new BigDecimal("10"), null, e -> {});
        QrScanner scanner = mock(QrScanner.class);

        assertEquals(ScanEvent.Kind.ACCEPTED, session.onDecoded(addressPayload).kind());
        session.close();
        session.open(scanner);

        assertEquals(ScanEvent.Kind.ACCEPTED, session.onDecoded(addressPayload).kind());
        assertAmountEquals("20", sender.getAllowanceGuard().getAllowance(SENDER_ADDRESS).spent());
        assertEquals(2, sender.getLedger().getPendingTransactions().size());
    }

    @Test
    void sendSessionIssuesToScannedAddress() throws OfflinePayException {
        CodeRenderer codeRenderer = mock(CodeRenderer.class);
        LedgerEventLogger eventLogger = mock(LedgerEventLogger.class);
        OfflinePay sender = new OfflinePay.Builder()
                .setCryptoProvider(cryptoProvider)
                .setClock(clock)
                .setCodeRenderer(codeRenderer)
                .setLedgerEventLogger(eventLogger)
                .build();
        sender.getAllowanceGuard().resetAllowance(SENDER_ADDRESS, new BigDecimal("100"));
        OfflinePay receiver = device(new MemoryLedgerStore());
        String addressPayload = receiver.displayReceivingAddress(RECEIVER_ADDRESS);

        ScanEvent<Voucher> event = sender.openSendSession(SENDER_KEY, new BigDecimal("12.5"), null, e -> {})
                .onDecoded(addressPayload);

        assertEquals(ScanEvent.Kind.ACCEPTED, event.kind());
        Voucher voucher = event.value();
        assertNotNull(voucher);
        assertEquals(RECEIVER_ADDRESS, voucher.to());
        verify(codeRenderer).render(VoucherCodec.encodeVoucher(voucher));
        verify(eventLogger).log(any());
        assertAmountEquals("12.5", receiver.receiveVoucher(VoucherCodec.encodeVoucher(voucher), RECEIVER_ADDRESS)
                .amount());
    }

    @Test
    void exposeReadOnlyLedgerStore() {
        OfflinePay device = device(new MemoryLedgerStore());
        assertThrows(UnsupportedOperationException.class,
                () -> device.getLedgerStore().updateOfflineBalances(OfflineBalances.ZERO));
    }

}
