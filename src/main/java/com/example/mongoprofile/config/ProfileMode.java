package com.example.mongoprofile.config;

/**
 * Which results a profiling run produces.
 */
public enum ProfileMode
{
    SCHEMA,  // structural schema only, single pass
    LINT,    // data-quality issues only
    FULL;    // both

    public boolean includesSchema()
    {
        return this != LINT;
    }

    public boolean includesLint()
    {
        return this != SCHEMA;
    }
}
