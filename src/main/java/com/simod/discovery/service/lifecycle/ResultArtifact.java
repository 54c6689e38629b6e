package com.simod.discovery.service.lifecycle;

import java.io.InputStream;

/**
 * An open artifact of a job. The caller closes the stream.
 */
public record ResultArtifact(String jobId, String fileName, InputStream content) {
}
