package de.bsommerfeld.repoindex.core.config;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.repoindex.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link IndexConfig} from a TOML file. A missing file yields the
 * defaults so a fresh repository can be indexed unsigned without setup.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    // config.toml is shared with other tools, keys this loader does not know are ignored
    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    public static IndexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            LOG.warn("No configuration at {}, using defaults", configPath.toAbsolutePath());
            return new IndexConfig();
        }
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        try {
            return parse(Files.readString(configPath));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + configPath, e);
        }
    }

    public static IndexConfig parse(String toml) {
        try {
            return MAPPER.readValue(toml, IndexConfig.class);
        } catch (JacksonException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        }
    }
}
