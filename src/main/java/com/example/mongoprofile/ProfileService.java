package com.example.mongoprofile;

import com.example.mongoprofile.aggregate.DocumentFolder;
import com.example.mongoprofile.aggregate.FoldListener;
import com.example.mongoprofile.aggregate.ObjectAggregate;
import com.example.mongoprofile.config.ProfileMode;
import com.example.mongoprofile.config.ProfileOptions;
import com.example.mongoprofile.lint.IssueDetector;
import com.example.mongoprofile.lint.IssueReport;
import com.example.mongoprofile.lint.MissingFieldCollector;
import com.example.mongoprofile.report.ProfileReport;
import com.example.mongoprofile.report.ReportAssembler;
import com.example.mongoprofile.schema.ExampleDocumentSelector;
import com.example.mongoprofile.schema.SchemaSummarizer;
import com.example.mongoprofile.schema.SchemaSummary;
import com.example.mongoprofile.source.DocumentSource;
import com.example.mongoprofile.source.DocumentSourceException;
import com.example.mongoprofile.source.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Runs one profiling job over a document source.
 *
 * <p>Pass 1 folds every document into an aggregate tree (counters only) and, for lint runs, collects bounded
 * evidence. Pass 2 re-reads the source only when some expected field turned out to be missing from documents,
 * to find example ids for them. A failure of the source aborts the run; no partial report is produced.
 */
public class ProfileService {
    private static final Logger logger = LoggerFactory.getLogger(ProfileService.class);

    private final ProfileOptions options;
    private final Clock clock;

    public ProfileService(ProfileOptions options) {
        this(options, Clock.systemUTC());
    }

    public ProfileService(ProfileOptions options, Clock clock) {
        this.options = options;
        this.clock = clock;
    }

    public ProfileResult profile(DocumentSource source) {
        ProfileMode mode = options.getMode();
        logger.info("=== PROFILING {} ===", source.getName());
        logger.info("Mode: {}", mode);
        logger.info("Sample limit: {}", options.getSampleLimit() == null ? "none" : options.getSampleLimit());

        ObjectAggregate root = new ObjectAggregate();
        IssueDetector detector = mode.includesLint() ? new IssueDetector(options) : null;
        ExampleDocumentSelector example = mode.includesSchema() && options.isIncludeExample()
                ? new ExampleDocumentSelector() : null;

        // Pass 1
        logger.info("=== Pass 1: folding documents ===");
        scan(source, document -> {
            FoldListener listener = detector == null ? FoldListener.NONE : detector.evidenceListener(document.getId());
            DocumentFolder.foldDocument(root, document.getPayload(), listener);
            if (example != null) {
                example.offer(document);
            }
        });
        long totalDocs = root.getTotalSeen();
        logger.info("Pass 1 complete: {} documents, {} top-level fields", totalDocs, root.getProperties().size());

        SchemaSummary schema = null;
        if (mode.includesSchema()) {
            schema = SchemaSummarizer.summarize(root);
        }

        IssueReport issues = null;
        if (detector != null) {
            MissingFieldCollector missing = null;
            Set<String> incomplete = detector.fieldsMissingEvidence(root, totalDocs);
            if (!incomplete.isEmpty()) {
                logger.info("=== Pass 2: collecting examples for {} incomplete expected fields ===", incomplete.size());
                missing = detector.missingFieldCollector(incomplete);
                scan(source, missing);
            } else {
                logger.info("Skipping pass 2: every expected field is present in all documents");
            }
            issues = detector.detect(root, totalDocs, missing);
        }

        ProfileReport report = ReportAssembler.assemble(source.getName(), options, totalDocs, schema,
                example == null ? null : example.getExample(), issues, clock.instant());
        logger.info("Profiling of {} complete", source.getName());
        return new ProfileResult(report, root);
    }

    /**
     * Feed the source to the consumer, stopping at the sample limit and checking for interruption between documents.
     */
    private void scan(DocumentSource source, Consumer<SourceDocument> consumer) {
        Integer limit = options.getSampleLimit();
        long[] seen = {0};
        source.forEach(document -> {
            if (Thread.currentThread().isInterrupted()) {
                throw new DocumentSourceException("Profiling of " + source.getName() + " interrupted after "
                        + seen[0] + " documents");
            }
            // the source stops at the limit; this guards sources that deliver past it
            if (limit != null && seen[0] >= limit) {
                return;
            }
            seen[0]++;
            consumer.accept(document);
        }, limit);
    }
}
