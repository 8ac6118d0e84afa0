package com.example.mongoprofile;

import com.example.mongoprofile.config.ProfileOptions;
import com.example.mongoprofile.report.FieldStatisticsCsvWriter;
import com.example.mongoprofile.report.ReportWriter;
import com.example.mongoprofile.source.MongoDocumentSource;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Command line entry point: profiles one collection and writes the report next to the other outputs.
 */
public class ProfileRunner {
    private static final Logger logger = LoggerFactory.getLogger(ProfileRunner.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: ProfileRunner <collection> [environment] [database]");
            System.err.println("Example: ProfileRunner listings");
            System.err.println("Example: ProfileRunner people lake realm");
            System.exit(1);
        }

        String collectionName = args[0];
        String environmentOverride = args.length > 1 ? args[1] : null;
        String databaseOverride = args.length > 2 ? args[2] : null;

        try {
            ProfilerConfig config = new ProfilerConfig(environmentOverride, databaseOverride);
            ProfileOptions options = config.getOptions();

            logger.info("=== COLLECTION PROFILE ===");
            logger.info("Collection: {}", collectionName);
            logger.info("Database: {}", config.getDatabaseName());

            try (MongoClient mongoClient = MongoClients.create(config.getMongoUrl())) {
                MongoDatabase database = mongoClient.getDatabase(config.getDatabaseName());
                MongoDocumentSource source = new MongoDocumentSource(
                        database.getCollection(collectionName, Document.class),
                        options.getBatchSize(),
                        options.getSampleLimit());

                ProfileResult result = new ProfileService(options).profile(source);

                Path outputDir = config.ensureOutputDirectory();
                ReportWriter writer = new ReportWriter(config.getOutputFormat());
                File reportFile = outputDir.resolve(
                        collectionName + "_profile." + config.getOutputFormat().getExtension()).toFile();
                writer.write(result.getReport(), reportFile);

                if (config.isWriteFieldCsv()) {
                    File csvFile = outputDir.resolve(collectionName + "_fields.csv").toFile();
                    new FieldStatisticsCsvWriter().write(result.getAggregate(), csvFile);
                }

                logger.info("=== PROFILE COMPLETE ===");
                logger.info("Documents scanned: {}", result.getReport().getMeta().getDocsScanned());
                logger.info("Report saved to: {}", reportFile.getAbsolutePath());
            }

        } catch (Exception e) {
            logger.error("Profiling failed", e);
            System.exit(1);
        }
    }
}
