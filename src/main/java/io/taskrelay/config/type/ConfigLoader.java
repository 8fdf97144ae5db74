package io.taskrelay.config.type;

import io.taskrelay.config.impl.RelayConfig;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads relay configuration from a YAML file.
     *
     * @param path the path to the relay YAML configuration file
     * @return a populated {@link RelayConfig}
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if a key holds a value of the wrong type
     */
    public static RelayConfig load(final Path path) throws IOException {
        try (final InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * Loads relay configuration from a classpath resource, e.g. the bundled {@code relay.yaml}.
     */
    public static RelayConfig loadResource(final String resource) throws IOException {
        try (final InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IOException("Config resource not found: " + resource);
            return load(in);
        }
    }

    static RelayConfig load(final InputStream in) {
        final Map<String, Object> root = new Yaml().load(in);
        return RelayConfig.fromMap(root);
    }
}
