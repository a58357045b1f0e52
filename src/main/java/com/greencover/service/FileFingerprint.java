package com.greencover.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Content hash of input files, so cache keys follow file bytes rather than file names
 */
@Slf4j
@Component
public class FileFingerprint {

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * SHA-256 of the file contents. An unreadable file is hashed by its path so
     * the key stays stable until the file becomes readable.
     */
    public String sha256(Path file) {
        MessageDigest digest = CacheKeyGenerator.digest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException e) {
            log.warn("Cannot read {} for fingerprinting, hashing its path instead: {}", file, e.getMessage());
            return CacheKeyGenerator.sha256("path:" + file.toAbsolutePath().normalize());
        }
    }
}
