package com.labtrace.lims.api.service.report;

import com.labtrace.lims.api.config.ReportProperties;
import com.labtrace.lims.api.service.error.RecordNotFoundException;
import com.labtrace.lims.api.service.error.UpstreamFailureException;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Keeps documents as files below a root directory; the key is the relative path.
 */
@Component
public class FilesystemDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FilesystemDocumentStore.class);

    private final Path root;

    @Autowired
    public FilesystemDocumentStore(ReportProperties properties) {
        this(Path.of(properties.getStore().getRootDir()));
    }

    FilesystemDocumentStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public StoredDocument put(String key, byte[] content, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException ex) {
            throw new UpstreamFailureException("Document key already in use: " + key, ex);
        } catch (IOException ex) {
            log.error("Failed to store document {}", key, ex);
            throw new UpstreamFailureException("Failed to store document " + key, ex);
        }
        log.debug("Stored document {} ({}, {} bytes)", key, contentType, content.length);
        return new StoredDocument(key, content.length, sha256Hex(content));
    }

    @Override
    public byte[] get(String key) {
        Path target = resolve(key);
        try {
            return Files.readAllBytes(target);
        } catch (NoSuchFileException ex) {
            throw new RecordNotFoundException("Document", key);
        } catch (IOException ex) {
            throw new UpstreamFailureException("Failed to read document " + key, ex);
        }
    }

    private Path resolve(String key) {
        if (StringUtils.isBlank(key)) {
            throw new IllegalArgumentException("Document key must not be blank");
        }
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Document key escapes the store root: " + key);
        }
        return target;
    }

    public static String sha256Hex(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
