package com.vclient.core.http;

import java.util.Objects;

/** File part of a multipart upload. */
public final class FilePayload {
    private final String filename;
    private final byte[] content;
    private final String contentType;

    public FilePayload(String filename, byte[] content, String contentType) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.content = Objects.requireNonNull(content, "content").clone();
        this.contentType = (contentType == null || contentType.isBlank()) ? "application/octet-stream" : contentType;
    }

    public String getFilename() { return filename; }
    public byte[] getContent() { return content.clone(); }
    public String getContentType() { return contentType; }
    public int size() { return content.length; }
}
