package com.hamclock.rigdaemon.adapter.rigctld;

import com.hamclock.rigdaemon.exception.RigDaemonException;

import java.math.BigDecimal;

/**
 * Parsers for rigctld reply text.
 */
public final class RigctldReplies {

    public static final String RPRT_PREFIX = "RPRT";

    private RigctldReplies() {}

    /**
     * Mode reply: mode name and passband in Hz (0 when the backend sent none).
     */
    public record ModeReply(String mode, int passbandHz) {}

    public static long parseFrequency(String reply) {
        requireNotError(reply);
        try {
            return new BigDecimal(reply.trim()).longValue();
        } catch (NumberFormatException e) {
            throw RigDaemonException.rigError("Unparseable frequency reply: '" + reply + "'", e);
        }
    }

    public static ModeReply parseMode(String reply) {
        requireNotError(reply);
        String[] parts = reply.trim().split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            throw RigDaemonException.rigError("Empty mode reply");
        }
        int passband = 0;
        if (parts.length > 1) {
            try {
                passband = Math.max(0, Integer.parseInt(parts[1]));
            } catch (NumberFormatException e) {
                passband = 0;
            }
        }
        return new ModeReply(parts[0], passband);
    }

    public static boolean parsePtt(String reply) {
        requireNotError(reply);
        return "1".equals(reply.trim());
    }

    /**
     * Accept an acknowledgement to a set command: {@code RPRT 0}, or any non-RPRT text from
     * backends that answer set commands without a report line.
     *
     * @throws RigDaemonException on a non-zero report code
     */
    public static void requireOk(String reply) {
        requireNotError(reply);
    }

    private static void requireNotError(String reply) {
        if (reply == null) {
            throw RigDaemonException.rigError("Empty reply");
        }
        String trimmed = reply.trim();
        if (!trimmed.startsWith(RPRT_PREFIX)) {
            return;
        }
        String code = trimmed.substring(RPRT_PREFIX.length()).trim();
        if (!"0".equals(code)) {
            throw RigDaemonException.rigError("rigctld error RPRT " + code);
        }
    }
}
