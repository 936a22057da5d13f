package xyz.benanderson.offlinepay.crypto;

/**
 * A freshly generated single-use keypair. The private key is the bearer instrument of a voucher.
 */
public record EphemeralKey(String privateKey, String address) {

    @Override
    public String toString() {
        return "EphemeralKey[address=" + address + "]";
    }

}
