package com.example.mongoprofile.report;

import com.example.mongoprofile.aggregate.FieldAggregate;
import com.example.mongoprofile.aggregate.ObjectAggregate;
import com.example.mongoprofile.aggregate.VariantAggregate;
import com.example.mongoprofile.lint.FieldPathFlattener;
import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Writes one CSV row per flattened field path with its presence and kind counts.
 */
public class FieldStatisticsCsvWriter {
    private static final Logger logger = LoggerFactory.getLogger(FieldStatisticsCsvWriter.class);

    static final String[] HEADER = {"field", "present_count", "present_pct", "kinds", "nullable", "type_mismatch"};

    public void write(ObjectAggregate root, File file) throws IOException {
        try (Writer out = new FileWriter(file, StandardCharsets.UTF_8)) {
            int rows = write(root, out);
            logger.info("Saved statistics for {} fields to: {}", rows, file.getAbsolutePath());
        }
    }

    /**
     * @return number of field rows written, header excluded
     */
    public int write(ObjectAggregate root, Writer out) throws IOException {
        long totalDocs = root.getTotalSeen();
        int rows = 0;
        CSVWriter writer = new CSVWriter(out);
        writer.writeNext(HEADER);
        for (Map.Entry<String, FieldAggregate> entry : FieldPathFlattener.flatten(root).entrySet()) {
            FieldAggregate field = entry.getValue();
            double pct = totalDocs == 0 ? 0 : (double) field.getPresentCount() / totalDocs;
            writer.writeNext(new String[]{
                    entry.getKey(),
                    Long.toString(field.getPresentCount()),
                    String.format(Locale.ROOT, "%.4f", pct),
                    kinds(field),
                    Boolean.toString(field.isNullable()),
                    Boolean.toString(field.getNonNullKinds().size() > 1)
            });
            rows++;
        }
        writer.flush();
        return rows;
    }

    private static String kinds(FieldAggregate field) {
        StringJoiner joiner = new StringJoiner(";");
        for (VariantAggregate variant : field.getVariants().values()) {
            joiner.add(variant.getKind().getWireName() + ":" + variant.getCount());
        }
        return joiner.toString();
    }
}
