package xyz.benanderson.offlinepay.web;

import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.StorageException;
import xyz.benanderson.offlinepay.hibernate.HibernateLedgerStore;
import xyz.benanderson.offlinepay.ledger.LedgerEventLogger;
import xyz.benanderson.offlinepay.scan.ScanMode;
import xyz.benanderson.offlinepay.storage.LedgerStore;
import xyz.benanderson.offlinepay.storage.MemoryLedgerStore;
import xyz.benanderson.offlinepay.storage.SingleFileLedgerStore;
import xyz.benanderson.offlinepay.util.Amounts;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalUnit;
import java.util.Locale;
import java.util.Optional;

public class ConfigurationParser {

    private final Configuration configuration;

    public ConfigurationParser(Configuration configuration) {
        this.configuration = configuration;
    }

    public OfflinePay createOfflinePay(LedgerEventLogger ledgerEventLogger) {
        OfflinePay.Builder builder = new OfflinePay.Builder();
        //ledger store
        builder.setLedgerStore(parseLedgerStore().orElseGet(() -> {
            OfflinePay.LOGGER.warn("No ledger storage configured - the ledger will not survive a restart");
            return new MemoryLedgerStore();
        }));
        //voucher validity
        builder.setVoucherValidity(parseVoucherValidity());
        //default allowance
        builder.setDefaultAllowanceLimit(parseDefaultAllowanceLimit());
        //event logger
        builder.setLedgerEventLogger(ledgerEventLogger);
        return builder.build();
    }

    public String parseWalletPrivateKey() {
        return configuration.getRequiredString("offlinepay.wallet.private_key");
    }

    public ScanMode parseScanMode() {
        return configuration.getString("offlinepay.scan.mode")
                .map(mode -> ScanMode.valueOf(mode.toUpperCase(Locale.ROOT)))
                .orElse(ScanMode.CONTINUOUS);
    }

    Duration parseVoucherValidity() {
        String prefix = "offlinepay.voucher.validity.";
        long amount = configuration.getRequiredInt(prefix + "amount");
        String unitName = configuration.getRequiredString(prefix + "unit");
        TemporalUnit unit = ChronoUnit.valueOf(unitName.toUpperCase(Locale.ROOT));
        return Duration.of(amount, unit);
    }

    BigDecimal parseDefaultAllowanceLimit() {
        return Amounts.normalize(configuration.getDecimal("offlinepay.allowance.default_limit").orElse(Amounts.ZERO));
    }

    org.hibernate.cfg.Configuration parseDatabase(String prefix) {
        String url = configuration.getRequiredString(prefix + "url");
        String driver = configuration.getRequiredString(prefix + "driver");
        String hbm2ddl = configuration.getRequiredString(prefix + "hbm2ddl");
        return new org.hibernate.cfg.Configuration()
                .setProperty("hibernate.connection.url", url)
                .setProperty("hibernate.connection.driver_class", driver)
                .setProperty("hibernate.hbm2ddl.auto", hbm2ddl);
    }

    /**
     * @return the configured store, or empty if none is configured
     * @throws IllegalStateException if the configured store could not be opened
     */
    Optional<LedgerStore> parseLedgerStore() {
        String prefix = "offlinepay.storage.";
        Optional<String> typeOptional = configuration.getString(prefix + "type");
        if (typeOptional.isEmpty())
            return Optional.empty();
        String type = typeOptional.get();
        switch (type.toLowerCase(Locale.ROOT)) {
            case "database":
            case "hibernate":
                try {
                    return Optional.of(new HibernateLedgerStore(parseDatabase(prefix)));
                } catch (StorageException e) {
                    throw new IllegalStateException("Failed to create HibernateLedgerStore", e);
                }
            case "memory":
                return Optional.of(new MemoryLedgerStore());
            case "file":
            case "singlefile":
            case "single_file":
                try {
                    return Optional.of(new SingleFileLedgerStore(Paths.get(configuration.getRequiredString(prefix + "path"))));
                } catch (IOException e) {
                    throw new IllegalStateException("Failed to create SingleFileLedgerStore", e);
                }
            default:
                OfflinePay.LOGGER.warn("Unknown ledger storage type '" + type + "'");
                return Optional.empty();
        }
    }

}
