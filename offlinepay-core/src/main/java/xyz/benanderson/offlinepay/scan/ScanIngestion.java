package xyz.benanderson.offlinepay.scan;

import lombok.Getter;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.OfflinePayException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Turns a noisy stream of decoded strings into at most one handler call per distinct code. Only one string is
 * processed at a time; anything decoded meanwhile is dropped, as are repeats of the last accepted or last rejected
 * string. Closing the session forgets both.
 *
 * @param <T> result of a successful handler call
 */
public class ScanIngestion<T> implements AutoCloseable {

    @Getter
    private final ScanMode mode;
    private final ScanHandler<T> handler;
    private final Consumer<ScanEvent<T>> listener;
    private final AtomicReference<ScanState> state = new AtomicReference<>(ScanState.IDLE);
    private final Object resolutionLock = new Object();
    private volatile String lastSeen, lastAccepted, lastRejected;
    private volatile boolean closed;
    private volatile QrScanner scanner;

    public ScanIngestion(ScanMode mode, ScanHandler<T> handler, Consumer<ScanEvent<T>> listener) {
        this.mode = mode;
        this.handler = handler;
        this.listener = listener;
    }

    public ScanIngestion(ScanMode mode, ScanHandler<T> handler) {
        this(mode, handler, event -> {});
    }

    public ScanState getState() {
        return state.get();
    }

    public boolean isClosed() {
        return closed;
    }

    public String getLastSeen() {
        return lastSeen;
    }

    public String getLastRejected() {
        return lastRejected;
    }

    /**
     * Subscribes to the scanner, reopening the session if it was closed or terminal.
     */
    public void open(QrScanner scanner) {
        synchronized (resolutionLock) {
            closed = false;
            state.compareAndSet(ScanState.TERMINAL, ScanState.IDLE);
            this.scanner = scanner;
        }
        scanner.start(this::onDecoded, this::onScannerError);
    }

    public ScanEvent<T> onDecoded(String decoded) {
        if (closed || decoded == null || isRepeat(decoded)) return ScanEvent.ignored(decoded);
        if (!state.compareAndSet(ScanState.IDLE, ScanState.PROCESSING)) return ScanEvent.ignored(decoded);

        ScanEvent<T> event;
        synchronized (resolutionLock) {
            // close() or another attempt may have resolved between the repeat check and the transition
            if (closed || isRepeat(decoded)) {
                state.set(ScanState.IDLE);
                return ScanEvent.ignored(decoded);
            }
            lastSeen = decoded;
            event = resolve(decoded);
        }
        if (event.kind() == ScanEvent.Kind.ACCEPTED && state.get() == ScanState.TERMINAL) stopScanner();
        listener.accept(event);
        return event;
    }

    private ScanEvent<T> resolve(String decoded) {
        try {
            T value = handler.handle(decoded);
            lastAccepted = decoded;
            state.set(mode == ScanMode.SINGLE ? ScanState.TERMINAL : ScanState.IDLE);
            return ScanEvent.accepted(decoded, value);
        } catch (OfflinePayException e) {
            OfflinePay.LOGGER.debug("Scanned code rejected: " + e.getMessage());
            return reject(decoded, e);
        } catch (RuntimeException e) {
            OfflinePay.LOGGER.error("Unexpected exception handling scanned code", e);
            return reject(decoded, e);
        }
    }

    private ScanEvent<T> reject(String decoded, Exception failure) {
        lastRejected = decoded;
        state.set(ScanState.IDLE);
        return ScanEvent.rejected(decoded, failure);
    }

    private boolean isRepeat(String decoded) {
        return decoded.equals(lastRejected) || decoded.equals(lastAccepted);
    }

    /**
     * Feeds a lazy stream of decoded strings through the session until it is terminal or closed.
     *
     * @return values of the accepted codes, in order
     */
    public List<T> consume(Stream<String> decodedStream) {
        List<T> accepted = new ArrayList<>();
        decodedStream.takeWhile(decoded -> !closed && state.get() != ScanState.TERMINAL)
                .map(this::onDecoded)
                .filter(event -> event.kind() == ScanEvent.Kind.ACCEPTED)
                .map(ScanEvent::value)
                .filter(Objects::nonNull)
                .forEach(accepted::add);
        return accepted;
    }

    private void onScannerError(Throwable throwable) {
        OfflinePay.LOGGER.warn("Scanner reported an error", throwable);
    }

    /**
     * Waits for an in-flight attempt to resolve, then returns to idle, forgets the remembered codes and unsubscribes
     * from the scanner. No ledger state is touched.
     */
    @Override
    public void close() {
        synchronized (resolutionLock) {
            closed = true;
            lastRejected = null;
            lastAccepted = null;
            state.set(ScanState.IDLE);
        }
        stopScanner();
    }

    private void stopScanner() {
        QrScanner current = scanner;
        scanner = null;
        if (current != null) current.stop();
    }

}
