package com.example.mongoprofile.report;

public enum OutputFormat {
    JSON("json"),
    YAML("yaml");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
