package xyz.benanderson.offlinepay.voucher;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

public record VerificationResult(boolean valid, @Nullable VerificationFailure failure) {

    private static final VerificationResult VALID = new VerificationResult(true, null);

    public VerificationResult {
        if (valid == (failure != null))
            throw new IllegalArgumentException("A result is either valid or carries a failure");
    }

    public static VerificationResult success() {
        return VALID;
    }

    public static VerificationResult failed(VerificationFailure failure) {
        return new VerificationResult(false, failure);
    }

    public Optional<VerificationFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

}
