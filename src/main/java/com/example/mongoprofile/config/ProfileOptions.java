package com.example.mongoprofile.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable options for one profiling run. Built and validated up front so that a bad option
 * fails the run before any document is read.
 */
public final class ProfileOptions
{
    public static final double DEFAULT_REQUIRED_THRESHOLD = 0.9;
    public static final double DEFAULT_RARE_FIELD_MAX_FRACTION = 0.05;
    public static final int DEFAULT_EXAMPLES_PER_ISSUE = 20;
    public static final int DEFAULT_BATCH_SIZE = 500;

    private final ProfileMode mode;
    private final double requiredThreshold;
    private final double rareFieldMaxFraction;
    private final int examplesPerIssue;
    private final Map<String, RegexRule> regexRules;
    private final boolean checkFieldNameVariants;
    private final Integer sampleLimit;
    private final int batchSize;
    private final boolean includeExample;

    private ProfileOptions(Builder builder)
    {
        this.mode = builder.mode;
        this.requiredThreshold = builder.requiredThreshold;
        this.rareFieldMaxFraction = builder.rareFieldMaxFraction;
        this.examplesPerIssue = builder.examplesPerIssue;
        this.regexRules = Collections.unmodifiableMap(new LinkedHashMap<>(builder.regexRules));
        this.checkFieldNameVariants = builder.checkFieldNameVariants;
        this.sampleLimit = builder.sampleLimit;
        this.batchSize = builder.batchSize;
        this.includeExample = builder.includeExample;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static ProfileOptions defaults()
    {
        return builder().build();
    }

    public static class Builder
    {
        private ProfileMode mode = ProfileMode.FULL;
        private double requiredThreshold = DEFAULT_REQUIRED_THRESHOLD;
        private double rareFieldMaxFraction = DEFAULT_RARE_FIELD_MAX_FRACTION;
        private int examplesPerIssue = DEFAULT_EXAMPLES_PER_ISSUE;
        private final List<RegexRule> rules = new ArrayList<>();
        private final Map<String, RegexRule> regexRules = new LinkedHashMap<>();
        private boolean checkFieldNameVariants = true;
        private Integer sampleLimit;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private boolean includeExample = true;

        public Builder mode(ProfileMode mode)
        {
            this.mode = mode;
            return this;
        }

        public Builder requiredThreshold(double threshold)
        {
            this.requiredThreshold = threshold;
            return this;
        }

        public Builder rareFieldMaxFraction(double fraction)
        {
            this.rareFieldMaxFraction = fraction;
            return this;
        }

        public Builder examplesPerIssue(int examples)
        {
            this.examplesPerIssue = examples;
            return this;
        }

        public Builder regexRule(String fieldPath, String regex)
        {
            return regexRule(RegexRule.of(fieldPath, regex));
        }

        public Builder regexRule(String fieldPath, String regex, String note)
        {
            return regexRule(RegexRule.of(fieldPath, regex, note));
        }

        public Builder regexRule(RegexRule rule)
        {
            rules.add(rule);
            return this;
        }

        public Builder checkFieldNameVariants(boolean check)
        {
            this.checkFieldNameVariants = check;
            return this;
        }

        /**
         * @param limit maximum documents per pass, {@code null} for unbounded
         */
        public Builder sampleLimit(Integer limit)
        {
            this.sampleLimit = limit;
            return this;
        }

        public Builder batchSize(int size)
        {
            this.batchSize = size;
            return this;
        }

        public Builder includeExample(boolean include)
        {
            this.includeExample = include;
            return this;
        }

        public ProfileOptions build()
        {
            if (mode == null)
            {
                throw new InvalidOptionException("mode", "must be one of SCHEMA, LINT, FULL");
            }
            if (!(requiredThreshold > 0 && requiredThreshold <= 1))
            {
                throw new InvalidOptionException("requiredThreshold", "must be in (0, 1], was " + requiredThreshold);
            }
            if (!(rareFieldMaxFraction >= 0 && rareFieldMaxFraction < 1))
            {
                throw new InvalidOptionException("rareFieldMaxFraction", "must be in [0, 1), was " + rareFieldMaxFraction);
            }
            if (rareFieldMaxFraction >= requiredThreshold)
            {
                throw new InvalidOptionException("rareFieldMaxFraction",
                        "must be below requiredThreshold (" + requiredThreshold + "), was " + rareFieldMaxFraction);
            }
            if (examplesPerIssue < 1)
            {
                throw new InvalidOptionException("examplesPerIssue", "must be at least 1, was " + examplesPerIssue);
            }
            if (sampleLimit != null && sampleLimit < 1)
            {
                throw new InvalidOptionException("sampleLimit", "must be positive or unset, was " + sampleLimit);
            }
            if (batchSize < 1)
            {
                throw new InvalidOptionException("batchSize", "must be at least 1, was " + batchSize);
            }
            regexRules.clear();
            for (RegexRule rule : rules)
            {
                if (regexRules.putIfAbsent(rule.getFieldPath(), rule) != null)
                {
                    throw new InvalidOptionException("regexRules." + rule.getFieldPath(), "declared more than once");
                }
            }
            return new ProfileOptions(this);
        }
    }

    public ProfileMode getMode()
    {
        return mode;
    }

    public double getRequiredThreshold()
    {
        return requiredThreshold;
    }

    public double getRareFieldMaxFraction()
    {
        return rareFieldMaxFraction;
    }

    public int getExamplesPerIssue()
    {
        return examplesPerIssue;
    }

    /**
     * Rules keyed by field path, in declaration order
     */
    public Map<String, RegexRule> getRegexRules()
    {
        return regexRules;
    }

    public boolean isCheckFieldNameVariants()
    {
        return checkFieldNameVariants;
    }

    public Integer getSampleLimit()
    {
        return sampleLimit;
    }

    public int getBatchSize()
    {
        return batchSize;
    }

    public boolean isIncludeExample()
    {
        return includeExample;
    }
}
