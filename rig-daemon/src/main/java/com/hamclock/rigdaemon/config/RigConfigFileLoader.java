package com.hamclock.rigdaemon.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.StandardEnvironment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the optional {@code rig-config.json} file and exposes it as Spring properties.
 *
 * <pre>
 * { "server": { "host": "0.0.0.0", "port": 5555 },
 *   "radio":  { "type": "flrig", "host": "127.0.0.1", "port": 12345,
 *               "pollInterval": 1000, "pttEnabled": false, "tuneDelay": 3000 } }
 * </pre>
 *
 * The file source sits just below the environment variables: command-line flags, system
 * properties and environment variables override it, and it overrides {@code application.yml}.
 * A missing file is normal; a malformed one is reported and skipped.
 */
public class RigConfigFileLoader implements EnvironmentPostProcessor, Ordered {

    public static final String CONFIG_FILE_PROPERTY = "rig.config-file";
    public static final String DEFAULT_CONFIG_FILE = "rig-config.json";
    public static final String PROPERTY_SOURCE_NAME = "rigConfigFile";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Log log;

    public RigConfigFileLoader(DeferredLogFactory logFactory) {
        this.log = logFactory.getLog(RigConfigFileLoader.class);
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Path path = Path.of(environment.getProperty(CONFIG_FILE_PROPERTY, DEFAULT_CONFIG_FILE));
        if (!Files.isRegularFile(path)) {
            log.debug("No rig config file at " + path.toAbsolutePath());
            return;
        }

        try {
            Map<String, Object> properties = toProperties(MAPPER.readTree(path.toFile()));
            MapPropertySource source = new MapPropertySource(PROPERTY_SOURCE_NAME, properties);
            MutablePropertySources sources = environment.getPropertySources();
            if (sources.contains(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME)) {
                sources.addAfter(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME, source);
            } else {
                sources.addLast(source);
            }
            log.info("📄 Loaded rig configuration from " + path.toAbsolutePath() + " " + properties.keySet());
        } catch (IOException | IllegalArgumentException e) {
            log.error("💥 Error loading " + path.toAbsolutePath() + ": " + e.getMessage());
        }
    }

    /**
     * Flattens the JSON document onto the daemon's property names.
     */
    static Map<String, Object> toProperties(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("rig config must be a JSON object");
        }

        Map<String, Object> properties = new LinkedHashMap<>();

        JsonNode server = root.path("server");
        if (server.isObject()) {
            putIfPresent(properties, "server.address", server.get("host"));
            putIfPresent(properties, "server.port", server.get("port"));
        }

        JsonNode radio = root.path("radio");
        if (radio.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = radio.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = switch (field.getKey()) {
                    case "port", "rigPort" -> "rig-port";
                    default -> toKebabCase(field.getKey());
                };
                putIfPresent(properties, "rig.radio." + key, field.getValue());
            }
            // "port" wins over "rigPort" when both are given
            putIfPresent(properties, "rig.radio.rig-port", radio.get("port"));
        }

        return properties;
    }

    private static void putIfPresent(Map<String, Object> properties, String key, JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return;
        }
        properties.put(key, value.asText());
    }

    static String toKebabCase(String camel) {
        StringBuilder sb = new StringBuilder(camel.length() + 4);
        for (char c : camel.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('-').append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
