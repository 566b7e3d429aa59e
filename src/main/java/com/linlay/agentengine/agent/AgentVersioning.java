package com.linlay.agentengine.agent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Agent version strings of the form {@code promptVersion.memoryNumber.memoryHash}, e.g.
 * {@code 3.12.9f86d081884c7d65}.
 */
public final class AgentVersioning {

    static final int HASH_LENGTH = 16;

    private AgentVersioning() {
    }

    /**
     * First 16 hex characters of the SHA-256 digest of {@code input + output}.
     */
    public static String memoryHash(String input, String output) {
        String combined = (input == null ? "" : input) + (output == null ? "" : output);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(combined.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    public static String version(int promptVersion, int memoryNumber, String memoryHash) {
        return promptVersion + "." + memoryNumber + "." + memoryHash;
    }

    public static Optional<ParsedVersion> parse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        String[] parts = version.split("\\.");
        if (parts.length != 3 || parts[2].isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ParsedVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), parts[2]));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public record ParsedVersion(int promptVersion, int memoryNumber, String memoryHash) {
    }
}
