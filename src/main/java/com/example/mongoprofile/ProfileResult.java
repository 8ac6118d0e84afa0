package com.example.mongoprofile;

import com.example.mongoprofile.aggregate.ObjectAggregate;
import com.example.mongoprofile.report.ProfileReport;

/**
 * Report of a finished run together with the aggregate it was derived from.
 */
public class ProfileResult {
    private final ProfileReport report;
    private final ObjectAggregate aggregate;

    ProfileResult(ProfileReport report, ObjectAggregate aggregate) {
        this.report = report;
        this.aggregate = aggregate;
    }

    public ProfileReport getReport() {
        return report;
    }

    /**
     * Read-only by convention once the run has finished
     */
    public ObjectAggregate getAggregate() {
        return aggregate;
    }
}
