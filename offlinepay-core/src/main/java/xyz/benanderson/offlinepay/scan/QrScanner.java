package xyz.benanderson.offlinepay.scan;

import java.util.function.Consumer;

/**
 * A camera decode loop. {@code onDecoded} may fire many times for the same physical code.
 */
public interface QrScanner {

    void start(Consumer<String> onDecoded, Consumer<Throwable> onError);

    void stop();

}
