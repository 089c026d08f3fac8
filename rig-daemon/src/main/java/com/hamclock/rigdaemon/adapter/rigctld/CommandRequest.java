package com.hamclock.rigdaemon.adapter.rigctld;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One rigctld command waiting in, or at the head of, the {@link CommandQueue}.
 * <p>
 * Most rigctld replies are one line. {@code m} (get mode) answers with the mode and the passband on
 * two lines; some builds print both on one line, so a mode reply also completes on a single line
 * that already carries both tokens. Any {@code RPRT n} line ends the reply.
 */
@Getter
public class CommandRequest {

    private final String command;
    private final CompletableFuture<String> response = new CompletableFuture<>();
    private final Instant enqueuedAt = Instant.now();
    private final int expectedLines;
    private final List<String> lines = new ArrayList<>(2);

    public CommandRequest(String command) {
        this.command = command;
        this.expectedLines = "m".equals(command) ? 2 : 1;
    }

    /**
     * Add one reply line.
     *
     * @return {@code true} once the reply is complete
     */
    boolean accept(String line) {
        lines.add(line);
        if (line.startsWith(RigctldReplies.RPRT_PREFIX)) {
            return true;
        }
        if (lines.size() >= expectedLines) {
            return true;
        }
        return lines.size() == 1 && line.trim().split("\\s+").length > 1;
    }

    String reply() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return "CommandRequest{" + command + "}";
    }
}
