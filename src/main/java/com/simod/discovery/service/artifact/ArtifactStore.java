package com.simod.discovery.service.artifact;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Interface for storing and retrieving job artifacts.
 *
 * Artifacts include the uploaded event log and configuration and the result
 * produced by the discovery engine. Every artifact lives in the namespace of
 * exactly one job and is addressed by a reference of the form
 * {@code <jobId>/<name>}; deleting a namespace deletes everything the job owns.
 */
public interface ArtifactStore {

    /**
     * Stores bytes as an artifact of a job.
     *
     * @param jobId owning job
     * @param name  file name within the job namespace, may contain sub-directories
     * @return reference to the stored artifact
     * @throws com.simod.discovery.service.exception.StorageException if storage fails
     */
    String store(String jobId, String name, byte[] content);

    /**
     * Stores a local file as an artifact of a job.
     *
     * @throws com.simod.discovery.service.exception.StorageException if storage fails
     */
    String store(String jobId, String name, Path source);

    /**
     * Opens an artifact for reading. The caller closes the stream.
     *
     * @throws com.simod.discovery.service.exception.StorageException if the artifact is missing or unreadable
     */
    InputStream open(String reference);

    /**
     * Checks if an artifact exists.
     */
    boolean exists(String reference);

    /**
     * Resolves a reference to a local path for processes that need a file.
     */
    Path resolve(String reference);

    /**
     * Returns a scratch directory inside the job namespace, created if needed.
     */
    Path workspace(String jobId);

    /**
     * Deletes every artifact of a job.
     *
     * @return true if the namespace existed
     * @throws com.simod.discovery.service.exception.StorageException if deletion fails
     */
    boolean deleteNamespace(String jobId);

    /**
     * Lists job namespaces with their last modification time.
     */
    Map<String, Instant> listNamespaces();
}
