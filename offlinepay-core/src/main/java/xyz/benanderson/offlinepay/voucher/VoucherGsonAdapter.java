package xyz.benanderson.offlinepay.voucher;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/**
 * Field names and order are the voucher wire format and must stay stable.
 */
public class VoucherGsonAdapter extends TypeAdapter<Voucher> {

    @Override
    public void write(JsonWriter jsonWriter, Voucher voucher) throws IOException {
        if (voucher == null) {
            jsonWriter.nullValue();
            return;
        }
        jsonWriter.beginObject();
        jsonWriter.name("version").value(voucher.version());
        jsonWriter.name("privateKey").value(voucher.ephemeralPrivateKey());
        jsonWriter.name("amount").value(voucher.amount());
        jsonWriter.name("from").value(voucher.from());
        jsonWriter.name("to").value(voucher.to());
        jsonWriter.name("timestamp").value(voucher.timestamp());
        jsonWriter.name("signature").value(voucher.signature());
        jsonWriter.endObject();
    }

    @Override
    public Voucher read(JsonReader jsonReader) throws IOException {
        if (jsonReader.peek() == JsonToken.NULL) {
            jsonReader.nextNull();
            return null;
        }
        Integer version = null;
        Long timestamp = null;
        String privateKey = null, amount = null, from = null, to = null, signature = null;

        jsonReader.beginObject();
        while (jsonReader.hasNext()) {
            String name = jsonReader.nextName();
            if (jsonReader.peek() == JsonToken.NULL) {
                jsonReader.nextNull();
                continue;
            }
            switch (name) {
                case "version" -> version = jsonReader.nextInt();
                case "privateKey" -> privateKey = jsonReader.nextString();
                case "amount" -> amount = jsonReader.nextString();
                case "from" -> from = jsonReader.nextString();
                case "to" -> to = jsonReader.nextString();
                case "timestamp" -> timestamp = jsonReader.nextLong();
                case "signature" -> signature = jsonReader.nextString();
                default -> jsonReader.skipValue();
            }
        }
        jsonReader.endObject();

        if (version == null) throw new JsonParseException("Voucher field 'version' is missing");
        if (timestamp == null) throw new JsonParseException("Voucher field 'timestamp' is missing");
        try {
            return new Voucher(version, privateKey, amount, from, to, timestamp, signature);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

}
