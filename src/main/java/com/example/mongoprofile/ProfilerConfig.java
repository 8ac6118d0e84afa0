package com.example.mongoprofile;

import com.example.mongoprofile.config.InvalidOptionException;
import com.example.mongoprofile.config.ProfileMode;
import com.example.mongoprofile.config.ProfileOptions;
import com.example.mongoprofile.report.OutputFormat;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration loaded from {@code application.conf} (overridable with system properties).
 * Every profiling option is read and validated here, before any connection is opened.
 */
public class ProfilerConfig
{
    private static final Logger logger = LoggerFactory.getLogger(ProfilerConfig.class);

    private final Config config;
    private final String currentEnvironment;
    private final String mongoUrl;
    private final String databaseName;
    private final String outputDirectory;
    private final OutputFormat outputFormat;
    private final boolean writeFieldCsv;
    private final ProfileOptions options;

    public ProfilerConfig()
    {
        this(ConfigFactory.load(), null, null);
    }

    public ProfilerConfig(String environmentOverride, String databaseOverride)
    {
        this(ConfigFactory.load(), environmentOverride, databaseOverride);
    }

    public ProfilerConfig(Config config, String environmentOverride, String databaseOverride)
    {
        this.config = config;
        this.currentEnvironment = environmentOverride != null ? environmentOverride : config.getString("current.environment");
        this.mongoUrl = loadMongoUrl();
        this.databaseName = databaseOverride != null ? databaseOverride : config.getString("database.name");
        this.outputDirectory = config.getString("output.directory");
        this.outputFormat = readEnum("profile.output-format", "outputFormat", OutputFormat.class);
        this.writeFieldCsv = readBoolean("profile.write-field-csv", "writeFieldCsv");
        this.options = loadOptions();

        logger.info("Configuration loaded successfully");
        logger.info("Environment: {}", currentEnvironment);
        logger.info("Database: {}", databaseName);
        logger.info("Output directory: {}", outputDirectory);
    }

    private String loadMongoUrl()
    {
        String urlKey = String.format("mongodb.url.%s", currentEnvironment);
        if (!config.hasPath(urlKey))
        {
            throw new InvalidOptionException(urlKey, "no MongoDB URL configured for environment " + currentEnvironment);
        }
        String url = config.getString(urlKey);

        if (url.contains("<username>") || url.contains("<password>") || url.contains("<host>"))
        {
            logger.warn("MongoDB URL contains placeholder values. Please update application.conf with actual credentials.");
        }

        return url;
    }

    private ProfileOptions loadOptions()
    {
        ProfileOptions.Builder builder = ProfileOptions.builder()
                .mode(readEnum("profile.mode", "mode", ProfileMode.class))
                .requiredThreshold(readDouble("profile.required-threshold", "requiredThreshold"))
                .rareFieldMaxFraction(readDouble("profile.rare-field-max-fraction", "rareFieldMaxFraction"))
                .examplesPerIssue(readInt("profile.examples-per-issue", "examplesPerIssue"))
                .checkFieldNameVariants(readBoolean("profile.check-field-name-variants", "checkFieldNameVariants"))
                .batchSize(readInt("profile.batch-size", "batchSize"))
                .includeExample(readBoolean("profile.include-example", "includeExample"));

        // absent or null means unbounded
        if (config.hasPath("profile.sample-limit"))
        {
            builder.sampleLimit(readInt("profile.sample-limit", "sampleLimit"));
        }

        if (config.hasPath("profile.regex-rules"))
        {
            try
            {
                for (Config rule : config.getConfigList("profile.regex-rules"))
                {
                    String field = rule.getString("field");
                    String note = rule.hasPath("note") ? rule.getString("note") : null;
                    builder.regexRule(field, rule.getString("regex"), note);
                }
            } catch (ConfigException e)
            {
                throw new InvalidOptionException("regexRules", e.getMessage(), e);
            }
        }

        return builder.build();
    }

    private double readDouble(String path, String option)
    {
        try
        {
            return config.getDouble(path);
        } catch (ConfigException e)
        {
            throw new InvalidOptionException(option, e.getMessage(), e);
        }
    }

    private int readInt(String path, String option)
    {
        try
        {
            return config.getInt(path);
        } catch (ConfigException e)
        {
            throw new InvalidOptionException(option, e.getMessage(), e);
        }
    }

    private boolean readBoolean(String path, String option)
    {
        try
        {
            return config.getBoolean(path);
        } catch (ConfigException e)
        {
            throw new InvalidOptionException(option, e.getMessage(), e);
        }
    }

    private <E extends Enum<E>> E readEnum(String path, String option, Class<E> type)
    {
        try
        {
            return config.getEnum(type, path);
        } catch (ConfigException e)
        {
            throw new InvalidOptionException(option, e.getMessage(), e);
        }
    }

    /**
     * Create the output directory if it does not exist yet.
     */
    public Path ensureOutputDirectory()
    {
        Path outputPath = Paths.get(outputDirectory);
        try
        {
            if (!Files.exists(outputPath))
            {
                Files.createDirectories(outputPath);
                logger.info("Created output directory: {}", outputDirectory);
            }
        } catch (IOException e)
        {
            throw new RuntimeException("Failed to create output directory: " + outputDirectory, e);
        }
        return outputPath;
    }

    public String getMongoUrl()
    {
        return mongoUrl;
    }

    public String getDatabaseName()
    {
        return databaseName;
    }

    public String getOutputDirectory()
    {
        return outputDirectory;
    }

    public String getCurrentEnvironment()
    {
        return currentEnvironment;
    }

    public OutputFormat getOutputFormat()
    {
        return outputFormat;
    }

    public boolean isWriteFieldCsv()
    {
        return writeFieldCsv;
    }

    public ProfileOptions getOptions()
    {
        return options;
    }
}
