package com.simod.discovery.service.lifecycle;

/**
 * A file received with a submission.
 *
 * @param filename    original file name, may be null
 * @param contentType declared content type, may be null
 * @param content     file bytes
 */
public record UploadedFile(String filename, String contentType, byte[] content) {

    public boolean isEmpty() {
        return content == null || content.length == 0;
    }

    public int size() {
        return content == null ? 0 : content.length;
    }
}
