package com.hamclock.rigdaemon.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates the daemon's space-separated launch flags into Spring Boot property arguments.
 *
 * <pre>
 *   --type flrig --rig-host 10.0.0.5 --rig-port 12345 --http-port 5555
 * </pre>
 *
 * becomes {@code --rig.radio.type=flrig --rig.radio.host=10.0.0.5 ...}. Arguments that are not
 * legacy flags (including Spring's own {@code --key=value} form) pass through untouched.
 * Stateless and thread-safe.
 */
public final class LegacyCliArgs {

    private static final Map<String, String> FLAG_TO_PROPERTY = Map.of(
        "--type", "rig.radio.type",
        "--rig-host", "rig.radio.host",
        "--rig-port", "rig.radio.rig-port",
        "--http-port", "server.port"
    );

    private LegacyCliArgs() {}

    public static String[] translate(String[] args) {
        if (args == null) {
            return new String[0];
        }

        List<String> translated = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String property = arg == null ? null : FLAG_TO_PROPERTY.get(arg.trim());
            if (property == null) {
                if (arg != null) {
                    translated.add(arg);
                }
                continue;
            }
            if (i + 1 >= args.length || args[i + 1] == null || args[i + 1].startsWith("--")) {
                throw new IllegalArgumentException("flag " + arg + " requires a value");
            }
            String value = args[++i].trim();
            if (value.isEmpty()) {
                throw new IllegalArgumentException("flag " + arg + " requires a value");
            }
            translated.add("--" + property + "=" + value);
        }
        return translated.toArray(new String[0]);
    }
}
