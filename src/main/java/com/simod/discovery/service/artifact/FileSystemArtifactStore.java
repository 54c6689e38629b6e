package com.simod.discovery.service.artifact;

import com.simod.discovery.service.config.StorageConfig;
import com.simod.discovery.service.exception.StorageException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * File system implementation of ArtifactStore.
 *
 * Layout: {@code <root>/<jobId>/<name>}. Writes go to a temporary file in the
 * target directory and are moved into place, so readers never see a partial
 * artifact.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemArtifactStore implements ArtifactStore {

    private static final String WORKSPACE_DIR = "work";

    private final StorageConfig storageConfig;

    private Path root;

    @PostConstruct
    public void init() {
        root = Path.of(storageConfig.getPath()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Cannot create artifact root " + root, e);
        }
        log.info("FileSystemArtifactStore initialized at {}", root);
    }

    @Override
    public String store(String jobId, String name, byte[] content) {
        Path target = targetPath(jobId, name);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discardTemp(temp);
            throw new StorageException("Failed to store artifact " + name + " for discovery " + jobId, jobId, e);
        }
        log.debug("Stored artifact {} ({} bytes)", target, content.length);
        return toReference(target);
    }

    @Override
    public String store(String jobId, String name, Path source) {
        Path target = targetPath(jobId, name);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discardTemp(temp);
            throw new StorageException("Failed to store artifact " + name + " for discovery " + jobId, jobId, e);
        }
        log.debug("Stored artifact {} from {}", target, source);
        return toReference(target);
    }

    @Override
    public InputStream open(String reference) {
        Path path = resolve(reference);
        try {
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new StorageException("Artifact not readable: " + reference, e);
        }
    }

    @Override
    public boolean exists(String reference) {
        return Files.isRegularFile(resolve(reference));
    }

    @Override
    public Path resolve(String reference) {
        Path path = root.resolve(reference).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new StorageException("Artifact reference outside of the store: " + reference);
        }
        return path;
    }

    @Override
    public Path workspace(String jobId) {
        Path workspace = namespace(jobId).resolve(WORKSPACE_DIR);
        try {
            return Files.createDirectories(workspace);
        } catch (IOException e) {
            throw new StorageException("Cannot create workspace for discovery " + jobId, jobId, e);
        }
    }

    @Override
    public boolean deleteNamespace(String jobId) {
        Path namespace = namespace(jobId);
        if (!Files.exists(namespace)) {
            return false;
        }
        try {
            FileUtils.deleteDirectory(namespace.toFile());
        } catch (IOException e) {
            throw new StorageException("Failed to delete artifacts of discovery " + jobId, jobId, e);
        }
        log.debug("Deleted artifact namespace {}", namespace);
        return true;
    }

    @Override
    public Map<String, Instant> listNamespaces() {
        Map<String, Instant> namespaces = new HashMap<>();
        try (Stream<Path> children = Files.list(root)) {
            children.filter(Files::isDirectory).forEach(dir -> {
                try {
                    namespaces.put(dir.getFileName().toString(), Files.getLastModifiedTime(dir).toInstant());
                } catch (IOException e) {
                    log.warn("Cannot read modification time of {}: {}", dir, e.getMessage());
                }
            });
        } catch (IOException e) {
            throw new StorageException("Failed to list artifact namespaces", e);
        }
        return namespaces;
    }

    // ==================== Helper Methods ====================

    private void discardTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove partial upload {}: {}", temp, e.getMessage());
        }
    }

    private Path namespace(String jobId) {
        return resolve(jobId);
    }

    private Path targetPath(String jobId, String name) {
        Path target = namespace(jobId).resolve(name).normalize();
        if (!target.startsWith(namespace(jobId)) || target.equals(namespace(jobId))) {
            throw new StorageException("Invalid artifact name: " + name);
        }
        return target;
    }

    private String toReference(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
