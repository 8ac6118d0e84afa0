package com.example.mongoprofile.config;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validation rule for the string values of one flattened field path (e.g. {@code profile.birthDate}).
 */
public final class RegexRule
{
    private final String fieldPath;
    private final Pattern pattern;
    private final String note;

    private RegexRule(String fieldPath, Pattern pattern, String note)
    {
        this.fieldPath = fieldPath;
        this.pattern = pattern;
        this.note = note;
    }

    /**
     * Compile a rule; a blank path or a malformed pattern is reported against {@code regexRules.<path>}.
     */
    public static RegexRule of(String fieldPath, String regex, String note)
    {
        if (fieldPath == null || fieldPath.isBlank())
        {
            throw new InvalidOptionException("regexRules", "field path must not be blank");
        }
        String option = "regexRules." + fieldPath;
        if (regex == null)
        {
            throw new InvalidOptionException(option, "missing regex");
        }
        try
        {
            return new RegexRule(fieldPath, Pattern.compile(regex), note);
        } catch (PatternSyntaxException e)
        {
            throw new InvalidOptionException(option, "malformed regex " + regex + " (" + e.getDescription() + ")", e);
        }
    }

    public static RegexRule of(String fieldPath, String regex)
    {
        return of(fieldPath, regex, null);
    }

    /**
     * Unanchored search; use {@code ^...$} in the pattern to validate the whole value
     */
    public boolean matches(String value)
    {
        return pattern.matcher(value).find();
    }

    public String getFieldPath()
    {
        return fieldPath;
    }

    public Pattern getPattern()
    {
        return pattern;
    }

    public String getNote()
    {
        return note;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof RegexRule)) return false;
        RegexRule that = (RegexRule) o;
        return fieldPath.equals(that.fieldPath)
                && pattern.pattern().equals(that.pattern.pattern())
                && Objects.equals(note, that.note);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(fieldPath, pattern.pattern(), note);
    }

    @Override
    public String toString()
    {
        return fieldPath + " ~ /" + pattern.pattern() + "/";
    }
}
