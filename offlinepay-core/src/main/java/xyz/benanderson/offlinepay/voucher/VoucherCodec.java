package xyz.benanderson.offlinepay.voucher;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonWriter;
import xyz.benanderson.offlinepay.exception.MalformedAddressException;
import xyz.benanderson.offlinepay.exception.MalformedVoucherException;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.regex.Pattern;

/**
 * Converts vouchers and receiving addresses to and from the strings carried by QR codes.
 */
public final class VoucherCodec {

    public static final String ADDRESS_PAYLOAD_TYPE = "address";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private VoucherCodec() {}

    public static String encodeVoucher(Voucher voucher) {
        return GSON.toJson(voucher, Voucher.class);
    }

    /**
     * @throws MalformedVoucherException if the text is not a JSON object holding every voucher field, names an
     * unsupported version, or carries an amount that is not a positive decimal with at most six fractional digits
     */
    public static Voucher decodeVoucher(String text) throws MalformedVoucherException {
        if (text == null || text.isBlank()) throw new MalformedVoucherException("Voucher payload is empty");
        Voucher voucher;
        try {
            voucher = GSON.fromJson(text.trim(), Voucher.class);
        } catch (JsonParseException | IllegalStateException | IllegalArgumentException e) {
            throw new MalformedVoucherException("Unreadable voucher payload: " + e.getMessage(), e);
        }
        if (voucher == null) throw new MalformedVoucherException("Voucher payload is empty");
        return voucher;
    }

    public static String encodeAddress(String address) {
        JsonObject payload = new JsonObject();
        payload.addProperty("type", ADDRESS_PAYLOAD_TYPE);
        payload.addProperty("address", address);
        return GSON.toJson(payload);
    }

    /**
     * Accepts either a tagged address payload or a bare address.
     *
     * @throws MalformedAddressException if neither form holds a syntactically valid address
     */
    public static String decodeAddress(String text) throws MalformedAddressException {
        if (text == null) throw new MalformedAddressException("Address payload is empty");
        String trimmed = text.trim();
        if (isValidAddress(trimmed)) return trimmed;
        if (!trimmed.startsWith("{")) throw new MalformedAddressException("Not an address or address payload");

        JsonElement element;
        try {
            element = JsonParser.parseString(trimmed);
        } catch (JsonParseException e) {
            throw new MalformedAddressException("Unreadable address payload");
        }
        if (!element.isJsonObject()) throw new MalformedAddressException("Address payload is not an object");
        JsonObject payload = element.getAsJsonObject();
        if (!isStringMember(payload, "type")
                || !ADDRESS_PAYLOAD_TYPE.equals(payload.get("type").getAsString()))
            throw new MalformedAddressException("Payload is not of type '" + ADDRESS_PAYLOAD_TYPE + "'");
        if (!isStringMember(payload, "address"))
            throw new MalformedAddressException("Address payload has no address");
        String address = payload.get("address").getAsString().trim();
        if (!isValidAddress(address)) throw new MalformedAddressException("Invalid address: " + address);
        return address;
    }

    private static boolean isStringMember(JsonObject object, String name) {
        JsonElement element = object.get(name);
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    public static boolean isValidAddress(String address) {
        return address != null && ADDRESS.matcher(address).matches();
    }

    /**
     * Builds the message a sender signs. The signature covers this tuple rather than the voucher fields, so the
     * key order and value types here are part of the protocol.
     */
    public static String signingMessage(String from, String to, String amount, long timestamp,
                                        String ephemeralAddress) {
        StringWriter out = new StringWriter();
        try (JsonWriter writer = new JsonWriter(out)) {
            writer.beginObject();
            writer.name("from").value(from);
            writer.name("to").value(to);
            writer.name("amount").value(amount);
            writer.name("timestamp").value(timestamp);
            writer.name("tempAddress").value(ephemeralAddress);
            writer.endObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

}
