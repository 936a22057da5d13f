package xyz.benanderson.offlinepay.scan;

import org.jetbrains.annotations.Nullable;
import xyz.benanderson.offlinepay.exception.InvalidVoucherException;
import xyz.benanderson.offlinepay.voucher.VerificationFailure;

import java.util.Optional;

public record ScanEvent<T>(Kind kind, String decoded, @Nullable T value, @Nullable Exception failure) {

    public enum Kind {
        ACCEPTED, REJECTED, IGNORED
    }

    static <T> ScanEvent<T> accepted(String decoded, T value) {
        return new ScanEvent<>(Kind.ACCEPTED, decoded, value, null);
    }

    static <T> ScanEvent<T> rejected(String decoded, Exception failure) {
        return new ScanEvent<>(Kind.REJECTED, decoded, null, failure);
    }

    static <T> ScanEvent<T> ignored(String decoded) {
        return new ScanEvent<>(Kind.IGNORED, decoded, null, null);
    }

    public Optional<VerificationFailure> getVerificationFailure() {
        if (!(failure instanceof InvalidVoucherException)) return Optional.empty();
        return Optional.of(((InvalidVoucherException) failure).getFailure());
    }

}
