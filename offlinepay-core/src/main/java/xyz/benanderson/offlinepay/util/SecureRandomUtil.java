package xyz.benanderson.offlinepay.util;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Locale;

public final class SecureRandomUtil {

    private SecureRandomUtil() {}

    /**
     * Prefers the non-blocking native source on unix-like systems, falling back to the platform's strong
     * instance elsewhere.
     */
    public static SecureRandom getSecureRandom() throws NoSuchAlgorithmException {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("nix") || os.contains("nux") || os.contains("mac")) {
            try {
                return SecureRandom.getInstance("NativePRNGNonBlocking");
            } catch (NoSuchAlgorithmException e) {
                try {
                    return SecureRandom.getInstance("NativePRNG");
                } catch (NoSuchAlgorithmException ex) {
                    return SecureRandom.getInstanceStrong();
                }
            }
        }
        return SecureRandom.getInstanceStrong();
    }

}
