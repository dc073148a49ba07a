package com.resultvault.storage.blob;

import com.resultvault.storage.StorageConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores artifacts as files under {root}/{userId}/{resultId}/{name}.
 * URIs are paths relative to the root, using '/' as separator. Distinct artifact
 * names of one result always land in distinct files.
 */
public class LocalBlobStore implements BlobStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalBlobStore.class);
    private static final Pattern INVALID_SEGMENT_CHARS = Pattern.compile("[^a-zA-Z0-9._-]");
    private static final int HASH_BYTES = 4;
    private static final Pattern HASHED_NAME = Pattern.compile(".*-[0-9a-f]{8}(\\.[^.]*)?");

    private final Path storageRoot;

    public LocalBlobStore(String localDir) {
        this.storageRoot = Paths.get(localDir).toAbsolutePath().normalize();

        try {
            Files.createDirectories(storageRoot);
            logger.info("Local blob store initialized with directory: {}", storageRoot);
        } catch (IOException e) {
            throw new StorageConfigurationException("Failed to create local storage directory: " + storageRoot, e);
        }
    }

    /**
     * Sanitizes one path segment to prevent directory traversal and invalid characters.
     */
    static String sanitizeSegment(String segment) {
        if (segment == null || segment.isEmpty()) {
            return "file";
        }
        String sanitized = INVALID_SEGMENT_CHARS.matcher(segment).replaceAll("_");
        sanitized = sanitized.replaceAll("\\.\\.", "_");
        if (sanitized.equals(".")) {
            return "_";
        }
        return sanitized;
    }

    /**
     * Maps an artifact name to a file name, one to one. A name that sanitizing would
     * change, or one that already looks like a mapped name, gets a short hash of the
     * original appended before its extension.
     */
    static String fileName(String name) {
        String sanitized = sanitizeSegment(name);
        if (sanitized.equals(name) && !HASHED_NAME.matcher(sanitized).matches()) {
            return sanitized;
        }
        String hash = shortHash(name == null ? "" : name);
        int dot = sanitized.lastIndexOf('.');
        if (dot <= 0) {
            return sanitized + "-" + hash;
        }
        return sanitized.substring(0, dot) + "-" + hash + sanitized.substring(dot);
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, HASH_BYTES);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Path getStorageRoot() {
        return storageRoot;
    }

    @Override
    public String put(String userId, String resultId, String name, byte[] content, String contentType) throws IOException {
        Path resultDir = resultDir(userId, resultId);
        Files.createDirectories(resultDir);
        Path filePath = resultDir.resolve(fileName(name));

        logger.debug("Writing artifact to local storage: {}", filePath);
        try {
            Files.write(filePath, content);
        } catch (IOException e) {
            logger.error("Failed to write artifact to local storage: {}", filePath, e);
            throw e;
        }
        return toUri(filePath);
    }

    @Override
    public byte[] get(String uri) throws IOException {
        Path filePath = resolve(uri);
        if (!Files.isRegularFile(filePath)) {
            throw new IOException("Artifact not found: " + uri);
        }
        return Files.readAllBytes(filePath);
    }

    @Override
    public void delete(String uri) throws IOException {
        Files.deleteIfExists(resolve(uri));
    }

    @Override
    public void prepareResult(String userId, String resultId) throws IOException {
        Files.createDirectories(resultDir(userId, resultId));
    }

    /**
     * Removes the result directory and anything still left in it.
     */
    @Override
    public void releaseResult(String userId, String resultId) throws IOException {
        Path resultDir = resultDir(userId, resultId);
        if (!Files.exists(resultDir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> stream = Files.walk(resultDir)) {
            paths = stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.LOCAL;
    }

    private Path resultDir(String userId, String resultId) {
        return storageRoot.resolve(sanitizeSegment(userId)).resolve(sanitizeSegment(resultId));
    }

    private String toUri(Path filePath) {
        return storageRoot.relativize(filePath).toString().replace('\\', '/');
    }

    private Path resolve(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("Invalid local storage uri: " + uri);
        }
        Path filePath = storageRoot.resolve(uri).normalize();
        if (!filePath.startsWith(storageRoot) || filePath.equals(storageRoot)) {
            throw new IllegalArgumentException("Path traversal detected: " + uri);
        }
        return filePath;
    }
}
