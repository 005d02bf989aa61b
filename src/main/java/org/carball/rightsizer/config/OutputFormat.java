package org.carball.rightsizer.config;

public enum OutputFormat {
    JSON(".json"),
    MARKDOWN(".md"),
    CSV(".csv"),
    ALL("");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
