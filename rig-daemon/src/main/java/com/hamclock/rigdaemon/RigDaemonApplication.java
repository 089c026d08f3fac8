package com.hamclock.rigdaemon;

import com.hamclock.rigdaemon.config.LegacyCliArgs;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Application Class - HTTP/SSE bridge between a web dashboard and a radio backend
 */
@SpringBootApplication
public class RigDaemonApplication {

    public static void main(String[] args) {
        System.out.println("🚀 Starting Rig Daemon...");
        System.out.println("☕ Java Version: " + System.getProperty("java.version"));

        try {
            SpringApplication.run(RigDaemonApplication.class, LegacyCliArgs.translate(args));
        } catch (IllegalArgumentException e) {
            System.err.println("💥 Invalid command line: " + e.getMessage());
            System.exit(2);
        }
    }
}
