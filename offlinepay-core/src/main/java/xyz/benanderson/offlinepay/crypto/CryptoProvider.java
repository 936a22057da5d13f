package xyz.benanderson.offlinepay.crypto;

import java.security.SignatureException;

/**
 * Key generation, message signing and signer recovery. Keys and signatures are {@code 0x} prefixed hex strings,
 * addresses are {@code 0x} prefixed 20 byte hex strings.
 */
public interface CryptoProvider {

    EphemeralKey generateKeypair();

    /**
     * @throws IllegalArgumentException if the private key is not usable key material
     */
    String deriveAddress(String privateKey);

    /**
     * @throws IllegalArgumentException if the private key is not usable key material
     */
    String sign(String privateKey, String message);

    /**
     * @throws SignatureException if no signer can be recovered from the signature
     */
    String recoverAddress(String message, String signature) throws SignatureException;

}
