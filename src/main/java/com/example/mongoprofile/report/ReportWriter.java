package com.example.mongoprofile.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Renders a {@link ProfileReport} as indented JSON or as YAML.
 */
public class ReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private final OutputFormat format;
    private final ObjectMapper mapper;

    public ReportWriter(OutputFormat format) {
        this.format = format;
        this.mapper = createMapper(format);
    }

    private static ObjectMapper createMapper(OutputFormat format) {
        ObjectMapper mapper;
        if (format == OutputFormat.YAML) {
            YAMLFactory factory = new YAMLFactory()
                    .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                    .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
            mapper = new ObjectMapper(factory);
        } else {
            mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return mapper;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public String writeToString(ProfileReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(report);
    }

    public void write(ProfileReport report, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Failed to create directory " + parent);
        }
        mapper.writeValue(file, report);
        logger.info("Saved {} profile report to: {}", format, file.getAbsolutePath());
    }
}
