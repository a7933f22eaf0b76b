package com.botwire.dispatch.poller;

import com.botwire.api.binding.BotJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;
import java.util.UUID;

/**
 * Last processed update id, persisted so a restarted poller resumes where it stopped.
 * <p>
 * File format: {@code {"version": 1, "lastUpdateId": 123}}. Writes go to a temp file that is then
 * moved over the target.
 */
@Slf4j
public class UpdateOffsetStore {

    private static final int STORE_VERSION = 1;

    private final Path file;
    private final ObjectMapper mapper = BotJson.mapper();

    public UpdateOffsetStore(Path file) {
        this.file = file;
    }

    /**
     * Store for one bot under {@code stateDir}, keyed by the bot id (the token part before the colon).
     */
    public static UpdateOffsetStore forBot(Path stateDir, String token) {
        return new UpdateOffsetStore(resolvePath(stateDir, botId(token)));
    }

    static Path resolvePath(Path stateDir, String botId) {
        return stateDir.resolve("update-offset-" + normalizeId(botId) + ".json");
    }

    public static String botId(String token) {
        if (token == null)
            return "default";
        int colon = token.indexOf(':');
        return colon > 0 ? token.substring(0, colon) : "default";
    }

    static String normalizeId(String id) {
        String trimmed = id != null ? id.trim() : "";
        if (trimmed.isEmpty())
            return "default";
        return trimmed.replaceAll("[^a-zA-Z0-9._-]+", "_");
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return the stored update id, or null when there is no usable file
     */
    public Long read() {
        if (!Files.exists(file))
            return null;
        try {
            JsonNode node = mapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            JsonNode id = node != null ? node.get("lastUpdateId") : null;
            if (id == null || !id.canConvertToLong() || !id.isIntegralNumber()) {
                log.warn("Ignoring offset file {} without a numeric lastUpdateId", file);
                return null;
            }
            return id.asLong();
        } catch (IOException e) {
            log.warn("Cannot read offset file {}: {}", file, e.getMessage());
            return null;
        }
    }

    public void write(long lastUpdateId) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = dir.resolve(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        ObjectNode payload = mapper.createObjectNode();
        payload.put("version", STORE_VERSION);
        payload.put("lastUpdateId", lastUpdateId);
        Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload) + "\n",
                StandardCharsets.UTF_8);
        try {
            Files.setPosixFilePermissions(tmp, Set.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", tmp);
        }
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
