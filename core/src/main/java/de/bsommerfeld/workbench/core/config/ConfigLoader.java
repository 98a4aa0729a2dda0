package de.bsommerfeld.workbench.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Loads a TOML configuration file into a POJO. If the file does not exist yet,
 * it is created from the defaults the supplied instance carries, so the user
 * gets an editable file on first start.
 *
 * <pre>
 * GlobalConfig config = ConfigLoader.from(path).load(GlobalConfig.class, GlobalConfig::new);
 * </pre>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path path;
    private final TomlMapper mapper;

    private ConfigLoader(Path path) {
        this.path = path;
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public static ConfigLoader from(Path path) {
        return new ConfigLoader(path);
    }

    /**
     * @param type     the configuration class
     * @param defaults factory for the default instance, used when the file is
     *                 absent
     * @throws UncheckedIOException if the file exists but cannot be read or
     *                              parsed, or the defaults cannot be written
     */
    public <T> T load(Class<T> type, Supplier<T> defaults) {
        try {
            if (!Files.exists(path)) {
                T config = defaults.get();
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null)
                    Files.createDirectories(parent);
                mapper.writeValue(path.toFile(), config);
                LOG.info("Created default configuration at {}", path.toAbsolutePath());
                return config;
            }
            return mapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + path, e);
        }
    }
}
