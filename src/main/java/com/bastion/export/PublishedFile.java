package com.bastion.export;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A blacklist file currently on disk.
 */
public class PublishedFile {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("path")
    private final String path;

    @JsonProperty("size")
    private final long size;

    @JsonProperty("lastModified")
    private final Instant lastModified;

    public PublishedFile(String name, String path, long size, Instant lastModified) {
        this.name = name;
        this.path = path;
        this.size = size;
        this.lastModified = lastModified;
    }

    public String getName() {
        return name;
    }

    /**
     * Public URL path of the file, e.g. {@code /public/blacklist/IP/BlackIP0.txt}
     */
    public String getPath() {
        return path;
    }

    public long getSize() {
        return size;
    }

    public Instant getLastModified() {
        return lastModified;
    }
}
