package com.hamclock.rigdaemon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RigConfigFileLoaderTest {

    private static final String CONFIG = """
        {
          "server": { "host": "127.0.0.1", "port": 6000 },
          "radio": {
            "type": "flrig",
            "host": "192.168.1.20",
            "port": 12346,
            "pollInterval": 500,
            "pttEnabled": true,
            "tuneDelay": 2000
          }
        }
        """;

    @TempDir
    Path dir;

    private final RigConfigFileLoader loader = new RigConfigFileLoader(destination -> destination.get());

    @Test
    void mapsJsonOntoDaemonProperties() throws Exception {
        Map<String, Object> properties = RigConfigFileLoader.toProperties(new ObjectMapper().readTree(CONFIG));

        assertEquals("127.0.0.1", properties.get("server.address"));
        assertEquals("6000", properties.get("server.port"));
        assertEquals("flrig", properties.get("rig.radio.type"));
        assertEquals("192.168.1.20", properties.get("rig.radio.host"));
        assertEquals("12346", properties.get("rig.radio.rig-port"));
        assertEquals("500", properties.get("rig.radio.poll-interval"));
        assertEquals("true", properties.get("rig.radio.ptt-enabled"));
        assertEquals("2000", properties.get("rig.radio.tune-delay"));
    }

    @Test
    void portWinsOverRigPort() throws Exception {
        Map<String, Object> properties = RigConfigFileLoader.toProperties(
            new ObjectMapper().readTree("{\"radio\": {\"port\": 4533, \"rigPort\": 4534}}"));

        assertEquals("4533", properties.get("rig.radio.rig-port"));
    }

    @Test
    void fileOverridesApplicationDefaultsButNotCommandLine() throws Exception {
        Path file = Files.writeString(dir.resolve("rig-config.json"), CONFIG);
        StandardEnvironment environment = environmentFor(file);
        environment.getPropertySources().addLast(new MapPropertySource("applicationYaml",
            Map.of("rig.radio.type", "rigctld", "rig.radio.poll-interval", "1000")));
        environment.getPropertySources().addFirst(new MapPropertySource("commandLineArgs",
            Map.of("rig.radio.host", "10.0.0.9")));

        loader.postProcessEnvironment(environment, new SpringApplication());

        assertEquals("flrig", environment.getProperty("rig.radio.type"));
        assertEquals("500", environment.getProperty("rig.radio.poll-interval"));
        assertEquals("10.0.0.9", environment.getProperty("rig.radio.host"));
    }

    @Test
    void malformedFileIsSkipped() throws Exception {
        Path file = Files.writeString(dir.resolve("rig-config.json"), "{ not json");
        StandardEnvironment environment = environmentFor(file);

        loader.postProcessEnvironment(environment, new SpringApplication());

        assertFalse(environment.getPropertySources().contains(RigConfigFileLoader.PROPERTY_SOURCE_NAME));
    }

    @Test
    void missingFileIsNormal() {
        StandardEnvironment environment = environmentFor(dir.resolve("absent.json"));

        loader.postProcessEnvironment(environment, new SpringApplication());

        assertFalse(environment.getPropertySources().contains(RigConfigFileLoader.PROPERTY_SOURCE_NAME));
    }

    @Test
    void camelCaseKeysBecomeKebabCase() {
        assertEquals("reconnect-delay", RigConfigFileLoader.toKebabCase("reconnectDelay"));
        assertEquals("host", RigConfigFileLoader.toKebabCase("host"));
    }

    private static StandardEnvironment environmentFor(Path file) {
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(new MapPropertySource("testConfigFile",
            Map.of(RigConfigFileLoader.CONFIG_FILE_PROPERTY, file.toString())));
        return environment;
    }
}
