package xyz.benanderson.offlinepay.storage;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;
import xyz.benanderson.offlinepay.ledger.OfflineBalances;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Persists the whole ledger as one JSON file. Every atomic operation rewrites the file through a temporary
 * sibling which is then moved over it, so the file always holds either the old or the new ledger.
 */
public class SingleFileLedgerStore implements LedgerStore {

    private final Path storageFile;
    private final Gson gson;
    private final Semaphore semaphore;
    private volatile LedgerSnapshot state;

    /**
     * @param storageFile Path to the ledger file, created with a new device id if it doesn't exist
     * @throws IOException If the ledger file could not be created or read, or does not hold a ledger
     * @throws IllegalArgumentException If the {@code storageFile} argument provided resolves to a folder
     * instead of a file.
     */
    public SingleFileLedgerStore(Path storageFile) throws IOException {
        this.storageFile = storageFile.toAbsolutePath();
        this.semaphore = new Semaphore(1);
        this.gson = new GsonBuilder().disableHtmlEscaping().create();

        if (Files.isDirectory(this.storageFile)) {
            throw new IllegalArgumentException("Storage file path provided resolved to a folder, not a file.");
        }
        if (!Files.exists(this.storageFile) || Files.size(this.storageFile) == 0) {
            LedgerSnapshot initial = LedgerSnapshot.empty();
            write(initial);
            this.state = initial;
            OfflinePay.LOGGER.info("Created ledger file " + this.storageFile + " for device " + initial.getDeviceId());
        } else {
            this.state = read();
        }
    }

    private LedgerSnapshot read() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(storageFile, StandardCharsets.UTF_8)) {
            LedgerSnapshot snapshot = gson.fromJson(reader, LedgerSnapshot.class);
            if (snapshot == null || !snapshot.isComplete())
                throw new IOException("Ledger file " + storageFile + " is incomplete");
            return snapshot;
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new IOException("Ledger file " + storageFile + " is corrupt", e);
        }
    }

    private void write(LedgerSnapshot snapshot) throws IOException {
        Path temporaryFile = Files.createTempFile(storageFile.getParent(),
                storageFile.getFileName().toString(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temporaryFile, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(gson.toJson(snapshot).getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) channel.write(buffer);
                channel.force(true);
            }
            Files.move(temporaryFile, storageFile,
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temporaryFile);
        }
    }

    @Override
    public String getDeviceId() {
        return state.getDeviceId();
    }

    @Override
    public OfflineBalances getOfflineBalances() {
        return state.getOfflineBalances();
    }

    @Override
    public List<PendingTransaction> getPendingTransactions() {
        return state.getPendingTransactions();
    }

    @Override
    public Optional<PendingTransaction> findPendingTransaction(String id) {
        return state.findPendingTransaction(id);
    }

    @Override
    public Optional<OfflineAllowance> findAllowance(String walletAddress) {
        return state.findAllowance(walletAddress);
    }

    @Override
    public <T> T atomically(LedgerOperation<T> operation) throws OfflinePayException {
        semaphore.acquireUninterruptibly();
        try {
            LedgerSnapshot working = state.copy();
            T result = operation.apply(working);
            try {
                write(working);
            } catch (IOException e) {
                OfflinePay.LOGGER.error("IO Exception occurred when saving the ledger file", e);
                throw new StorageException("Could not save ledger file " + storageFile, e);
            }
            state = working;
            return result;
        } finally {
            semaphore.release();
        }
    }

}
