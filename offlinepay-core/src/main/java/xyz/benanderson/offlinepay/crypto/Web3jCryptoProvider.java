package xyz.benanderson.offlinepay.crypto;

import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;
import xyz.benanderson.offlinepay.util.SecureRandomUtil;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * secp256k1 keys with EIP-191 personal message signatures, as used by EVM wallets. Signatures are encoded as
 * {@code r || s || v} (65 bytes).
 */
public class Web3jCryptoProvider implements CryptoProvider {

    private static final Pattern PRIVATE_KEY = Pattern.compile("^(0x)?[0-9a-fA-F]{64}$");
    private static final Pattern SIGNATURE = Pattern.compile("^(0x)?[0-9a-fA-F]{130}$");

    private final SecureRandom secureRandom;

    public Web3jCryptoProvider() throws NoSuchAlgorithmException {
        this(SecureRandomUtil.getSecureRandom());
    }

    public Web3jCryptoProvider(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    @Override
    public EphemeralKey generateKeypair() {
        ECKeyPair keyPair;
        try {
            keyPair = Keys.createEcKeyPair(secureRandom);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("secp256k1 key generation is unavailable", e);
        }
        return new EphemeralKey(Numeric.toHexStringWithPrefixZeroPadded(keyPair.getPrivateKey(), 64),
                Keys.toChecksumAddress(Keys.getAddress(keyPair)));
    }

    @Override
    public String deriveAddress(String privateKey) {
        return Keys.toChecksumAddress(Keys.getAddress(toKeyPair(privateKey)));
    }

    @Override
    public String sign(String privateKey, String message) {
        Sign.SignatureData signature = Sign.signPrefixedMessage(
                message.getBytes(StandardCharsets.UTF_8), toKeyPair(privateKey));
        byte[] encoded = new byte[65];
        System.arraycopy(signature.getR(), 0, encoded, 0, 32);
        System.arraycopy(signature.getS(), 0, encoded, 32, 32);
        encoded[64] = signature.getV()[0];
        return Numeric.toHexString(encoded);
    }

    @Override
    public String recoverAddress(String message, String signature) throws SignatureException {
        if (signature == null || !SIGNATURE.matcher(signature).matches())
            throw new SignatureException("Signature is not 65 bytes of hex");
        byte[] bytes = Numeric.hexStringToByteArray(signature);
        byte v = bytes[64];
        if (v < 27) v += 27;
        Sign.SignatureData signatureData = new Sign.SignatureData(v,
                Arrays.copyOfRange(bytes, 0, 32), Arrays.copyOfRange(bytes, 32, 64));
        BigInteger publicKey;
        try {
            publicKey = Sign.signedPrefixedMessageToKey(message.getBytes(StandardCharsets.UTF_8), signatureData);
        } catch (RuntimeException e) {
            throw new SignatureException("Could not recover signer", e);
        }
        return Keys.toChecksumAddress(Keys.getAddress(publicKey));
    }

    private static ECKeyPair toKeyPair(String privateKey) {
        if (privateKey == null || !PRIVATE_KEY.matcher(privateKey).matches())
            throw new IllegalArgumentException("Private key must be 32 bytes of hex");
        BigInteger key = Numeric.toBigInt(privateKey);
        if (key.signum() <= 0 || key.compareTo(Sign.CURVE_PARAMS.getN()) >= 0)
            throw new IllegalArgumentException("Private key is outside the secp256k1 range");
        return ECKeyPair.create(key);
    }

}
