package xyz.benanderson.offlinepay.web;

import lombok.Getter;
import xyz.benanderson.offlinepay.OfflinePay;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Properties read from {@code offlinepay.properties} in the config folder, backed by the bundled defaults. An
 * environment variable with the same name as a key takes precedence over both.
 */
@Getter
public class Configuration {

    private final Properties properties;
    private final String configFileName = "offlinepay.properties";
    private final Path configFile;

    public Configuration(Path configFolder) {
        configFile = configFolder.resolve(configFileName);
        Properties internalProperties = new Properties();
        loadInternalProperties(internalProperties);
        this.properties = new Properties(internalProperties);
        if (createFileIfNotExists()) {
            loadFromFile();
        }
    }

    private void loadInternalProperties(Properties internalProperties) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(configFileName)) {
            if (inputStream == null) throw new IOException("'" + configFileName + "' is not on the classpath");
            internalProperties.load(inputStream);
        } catch (IOException e) {
            OfflinePay.LOGGER.error("Failed to read internal configuration file.", e);
        }
    }

    private void loadFromFile() {
        try (InputStream inputStream = Files.newInputStream(configFile)) {
            this.properties.load(inputStream);
        } catch (IOException e) {
            OfflinePay.LOGGER.error("Failed to read external configuration file - resorting to internal configuration.", e);
        }
    }

    /**
     * @return whether configuration should be loaded from the file
     */
    private boolean createFileIfNotExists() {
        if (!Files.exists(configFile)) {
            try (InputStream inputStream = this.getClass().getClassLoader().getResourceAsStream(configFileName)) {
                Files.copy(Objects.requireNonNull(inputStream), configFile);
            } catch (Exception e) {
                OfflinePay.LOGGER.error("Failed to write default config to configuration file '" + configFile + "'.", e);
                return false;
            }
        }
        return true;
    }

    public Optional<String> getString(String key) {
        String env = System.getenv(key);
        if (env == null || env.isBlank()) {
            String value = this.properties.getProperty(key);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.strip());
        }
        return Optional.of(env.strip());
    }

    public String getRequiredString(String key) {
        return getString(key).orElseThrow(() -> new NoSuchElementException("'" + key + "' cannot be empty"));
    }

    public Optional<Integer> getInt(String key) {
        Optional<String> value = getString(key);
        if (value.isEmpty()) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(value.get()));
        } catch (NumberFormatException e) {
            OfflinePay.LOGGER.warn("'" + key + "' is not an integer: " + value.get());
            return Optional.empty();
        }
    }

    public int getRequiredInt(String key) {
        return getInt(key).orElseThrow(() -> new NoSuchElementException("'" + key + "' must be an integer"));
    }

    public Optional<BigDecimal> getDecimal(String key) {
        Optional<String> value = getString(key);
        if (value.isEmpty()) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(value.get()));
        } catch (NumberFormatException e) {
            OfflinePay.LOGGER.warn("'" + key + "' is not a decimal: " + value.get());
            return Optional.empty();
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return getString(key).map(Boolean::parseBoolean).orElse(defaultValue);
    }

}
