package com.saletracker.tracker.infrastructure.storage;

import com.saletracker.tracker.domain.exceptions.StorageException;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * One pretty-printed JSON document on disk.
 *
 * <p>Reads recover from a missing, non-UTF-8 or unparseable file by reinitializing it to
 * {@code emptyJson}; an undecodable or unparseable file is first moved aside with a
 * {@code .corrupt} suffix. Writes go to a sibling temp file that is then moved over the target,
 * so a crash never leaves a truncated document.
 */
@Slf4j
class JsonDocumentFile<T> {

    static final String CORRUPT_SUFFIX = ".corrupt";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path path;
    private final ObjectMapper objectMapper;
    private final TypeReference<T> type;
    private final String emptyJson;

    JsonDocumentFile(Path path, ObjectMapper objectMapper, TypeReference<T> type, String emptyJson) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.type = type;
        this.emptyJson = emptyJson;
    }

    Path path() {
        return path;
    }

    /** @return the parsed document, or empty when the file was missing or had to be reinitialized */
    Optional<T> read() {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.info("{} does not exist, creating an empty document", path);
            writeRaw(emptyJson);
            return Optional.empty();
        } catch (CharacterCodingException e) {
            log.error("{} is not valid UTF-8, moving it aside and reinitializing", path);
            moveAside();
            writeRaw(emptyJson);
            return Optional.empty();
        } catch (IOException e) {
            throw StorageException.readFailed(path.toString(), e);
        }

        if (content.isBlank()) {
            log.warn("{} is blank, reinitializing", path);
            writeRaw(emptyJson);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(content, type));
        } catch (JacksonException e) {
            log.error("{} is corrupt ({}), moving it aside and reinitializing", path, e.getOriginalMessage());
            moveAside();
            writeRaw(emptyJson);
            return Optional.empty();
        }
    }

    void write(T document) {
        String content;
        try {
            content = objectMapper.writeValueAsString(document);
        } catch (JacksonException e) {
            throw StorageException.writeFailed(path.toString(), e);
        }
        writeRaw(content);
    }

    private void writeRaw(String content) {
        var temp = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw StorageException.writeFailed(path.toString(), e);
        }
    }

    private void moveAside() {
        var backup = path.resolveSibling(path.getFileName() + CORRUPT_SUFFIX);
        try {
            Files.move(path, backup, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Corrupt document kept as {}", backup);
        } catch (IOException e) {
            throw StorageException.writeFailed(backup.toString(), e);
        }
    }
}
