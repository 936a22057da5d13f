package xyz.benanderson.offlinepay.ledger;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import xyz.benanderson.offlinepay.util.Amounts;
import xyz.benanderson.offlinepay.voucher.Voucher;
import xyz.benanderson.offlinepay.voucher.VoucherGsonAdapter;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

public class PendingTransactionGsonAdapter extends TypeAdapter<PendingTransaction> {

    private final VoucherGsonAdapter voucherAdapter = new VoucherGsonAdapter();

    @Override
    public void write(JsonWriter jsonWriter, PendingTransaction transaction) throws IOException {
        if (transaction == null) {
            jsonWriter.nullValue();
            return;
        }
        jsonWriter.beginObject();
        jsonWriter.name("id").value(transaction.id());
        jsonWriter.name("type").value(transaction.type().name().toLowerCase(Locale.ROOT));
        jsonWriter.name("from").value(transaction.from());
        jsonWriter.name("to").value(transaction.to());
        jsonWriter.name("amount").value(Amounts.format(transaction.amount()));
        jsonWriter.name("voucher_data");
        voucherAdapter.write(jsonWriter, transaction.voucher());
        jsonWriter.name("ephemeral_address").value(transaction.ephemeralAddress());
        jsonWriter.name("timestamp").value(transaction.timestamp().toEpochMilli());
        jsonWriter.name("status").value(transaction.status().name().toLowerCase(Locale.ROOT));
        jsonWriter.name("device_id").value(transaction.deviceId());
        jsonWriter.name("tx_hash").value(transaction.txHash());
        jsonWriter.endObject();
    }

    @Override
    public PendingTransaction read(JsonReader jsonReader) throws IOException {
        if (jsonReader.peek() == JsonToken.NULL) {
            jsonReader.nextNull();
            return null;
        }
        String id = null, from = null, to = null, ephemeralAddress = null, deviceId = null, txHash = null;
        TransactionType type = null;
        TransactionStatus status = null;
        BigDecimal amount = null;
        Voucher voucher = null;
        Instant timestamp = null;

        jsonReader.beginObject();
        while (jsonReader.hasNext()) {
            String name = jsonReader.nextName();
            if (jsonReader.peek() == JsonToken.NULL) {
                jsonReader.nextNull();
                continue;
            }
            switch (name) {
                case "id" -> id = jsonReader.nextString();
                case "type" -> type = TransactionType.valueOf(jsonReader.nextString().toUpperCase(Locale.ROOT));
                case "from" -> from = jsonReader.nextString();
                case "to" -> to = jsonReader.nextString();
                case "amount" -> amount = new BigDecimal(jsonReader.nextString());
                case "voucher_data" -> voucher = voucherAdapter.read(jsonReader);
                case "ephemeral_address" -> ephemeralAddress = jsonReader.nextString();
                case "timestamp" -> timestamp = Instant.ofEpochMilli(jsonReader.nextLong());
                case "status" -> status = TransactionStatus.valueOf(jsonReader.nextString().toUpperCase(Locale.ROOT));
                case "device_id" -> deviceId = jsonReader.nextString();
                case "tx_hash" -> txHash = jsonReader.nextString();
                default -> jsonReader.skipValue();
            }
        }
        jsonReader.endObject();

        if (amount == null || timestamp == null)
            throw new JsonParseException("Pending transaction is missing its amount or timestamp");
        try {
            return new PendingTransaction(id, type, from, to, amount, voucher, ephemeralAddress, timestamp, status,
                    deviceId, txHash);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

}
