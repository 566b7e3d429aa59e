package com.linlay.agentengine.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One markdown document per agent at {@code <root>/<agentId>/memory.md}.
 */
@Component
public class StructuredMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(StructuredMemoryStore.class);
    static final String FILE_NAME = "memory.md";

    private final StructuredMemoryProperties properties;

    public StructuredMemoryStore(StructuredMemoryProperties properties) {
        this.properties = properties;
    }

    public Optional<String> read(String agentId) {
        Path file = resolveFile(agentId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, charset()));
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read memory of agent " + agentId, ex);
        }
    }

    public void write(String agentId, String content) {
        Path file = resolveFile(agentId);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
            Files.writeString(tmp, content == null ? "" : content, charset());
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote structured memory for agent {} ({} chars)", agentId, content == null ? 0 : content.length());
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot write memory of agent " + agentId, ex);
        }
    }

    public boolean exists(String agentId) {
        return Files.isRegularFile(resolveFile(agentId));
    }

    Path resolveFile(String agentId) {
        if (!StringUtils.hasText(agentId) || agentId.contains("/") || agentId.contains("\\") || agentId.contains("..")) {
            throw new IllegalArgumentException("Invalid agent id for memory storage: " + agentId);
        }
        return Paths.get(properties.getRootDir()).toAbsolutePath().normalize().resolve(agentId).resolve(FILE_NAME);
    }

    private Charset charset() {
        try {
            return Charset.forName(properties.getCharset());
        } catch (Exception ex) {
            return StandardCharsets.UTF_8;
        }
    }
}
