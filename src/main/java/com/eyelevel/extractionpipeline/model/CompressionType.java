package com.eyelevel.extractionpipeline.model;

/**
 * Compression applied to a finished CSV artifact.
 */
public enum CompressionType {
    NONE(""),
    GZIP(".gz"),
    ZIP(".zip");

    private final String extension;

    CompressionType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
