package xyz.benanderson.offlinepay.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Fixed-point helpers for voucher amounts. Amounts carry the six fractional digits of the settled asset and are
 * never rounded: anything finer is refused.
 */
public final class Amounts {

    public static final int SCALE = 6;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final Pattern DECIMAL = Pattern.compile("^\\d+(\\.\\d+)?$");

    private Amounts() {}

    /**
     * @param text plain decimal text, e.g. {@code "40"} or {@code "0.015000"}
     * @return the amount at scale 6
     * @throws IllegalArgumentException if the text is not a plain positive decimal, or has more than six
     * significant fractional digits
     */
    public static BigDecimal parsePositive(String text) {
        if (text == null || !DECIMAL.matcher(text).matches())
            throw new IllegalArgumentException("Amount must be a plain decimal number");
        return requirePositive(new BigDecimal(text));
    }

    public static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0)
            throw new IllegalArgumentException("Amount must be greater than zero");
        return normalize(amount);
    }

    /**
     * @throws IllegalArgumentException if the amount cannot be held at scale 6 without rounding
     */
    public static BigDecimal normalize(BigDecimal amount) {
        try {
            return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount has more than " + SCALE + " fractional digits", e);
        }
    }

    public static String format(BigDecimal amount) {
        return normalize(amount).toPlainString();
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

}
