package com.github.musiKk.quench;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Reads {@code quench.cfg} (a properties file). A missing file means defaults.
 */
public class ConfigReader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigReader.class);

    public static final String DEFAULT_CONFIG_FILE = "quench.cfg";

    public static Config readConfig() {
        return readConfig(Path.of(DEFAULT_CONFIG_FILE));
    }

    public static Config readConfig(Path path) {
        var config = new Config();
        if (!Files.isRegularFile(path)) {
            LOG.debug("no configuration at {}, using defaults", path.toAbsolutePath());
            return config;
        }

        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            properties.load(in);
        } catch (IOException e) {
            throw new IoFailureException("cannot read configuration " + path, e);
        }
        config.collectionsModule = properties.getProperty("collectionsModule", config.collectionsModule).trim();
        config.runtimeCommand = properties.getProperty("runtimeCommand", config.runtimeCommand).trim();
        LOG.debug("read {} from {}", config, path);
        return config;
    }

    @ToString
    @Accessors(fluent = true)
    @Getter
    public static class Config {
        private String collectionsModule = "immutable";
        private String runtimeCommand = "node";

        public void applyConfig(ConfigTarget ct) {
            ct.setCollectionsModule(collectionsModule);
            ct.setRuntimeCommand(runtimeCommand);
        }
    }

    public interface ConfigTarget {
        default void setCollectionsModule(String collectionsModule) {
        }

        default void setRuntimeCommand(String runtimeCommand) {
        }
    }

}
