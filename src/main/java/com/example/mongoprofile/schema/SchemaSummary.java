package com.example.mongoprofile.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Declarative description of one field (or of the document root) derived from an aggregate.
 * Read-only once built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "format", "required", "nullable", "union", "items", "requiredFields", "fields"})
public class SchemaSummary
{
    @JsonProperty("type")
    private final String type;

    @JsonProperty("format")
    private String format;

    @JsonProperty("required")
    private Boolean required;

    @JsonProperty("nullable")
    private Boolean nullable;

    @JsonProperty("union")
    private List<String> union;

    @JsonProperty("items")
    private SchemaSummary items;

    @JsonProperty("requiredFields")
    private List<String> requiredFields;

    @JsonProperty("fields")
    private SortedMap<String, SchemaSummary> fields;

    SchemaSummary(String type)
    {
        this.type = type;
    }

    SchemaSummary withPresence(boolean required, boolean nullable)
    {
        this.required = required;
        this.nullable = nullable;
        return this;
    }

    SchemaSummary withFormat(String format)
    {
        this.format = format;
        return this;
    }

    SchemaSummary withUnion(List<String> union)
    {
        this.union = Collections.unmodifiableList(union);
        return this;
    }

    SchemaSummary withItems(SchemaSummary items)
    {
        this.items = items;
        return this;
    }

    SchemaSummary withFields(Map<String, SchemaSummary> fields, List<String> requiredFields)
    {
        this.fields = Collections.unmodifiableSortedMap(new TreeMap<>(fields));
        this.requiredFields = requiredFields.isEmpty() ? null : Collections.unmodifiableList(requiredFields);
        return this;
    }

    public String getType()
    {
        return type;
    }

    public String getFormat()
    {
        return format;
    }

    /**
     * {@code null} on the document root and on the placeholder for arrays that were always empty
     */
    public Boolean getRequired()
    {
        return required;
    }

    public Boolean getNullable()
    {
        return nullable;
    }

    public List<String> getUnion()
    {
        return union;
    }

    public SchemaSummary getItems()
    {
        return items;
    }

    public List<String> getRequiredFields()
    {
        return requiredFields;
    }

    public SortedMap<String, SchemaSummary> getFields()
    {
        return fields;
    }

    public SchemaSummary getField(String name)
    {
        return fields == null ? null : fields.get(name);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof SchemaSummary)) return false;
        SchemaSummary that = (SchemaSummary) o;
        return type.equals(that.type)
                && Objects.equals(format, that.format)
                && Objects.equals(required, that.required)
                && Objects.equals(nullable, that.nullable)
                && Objects.equals(union, that.union)
                && Objects.equals(items, that.items)
                && Objects.equals(requiredFields, that.requiredFields)
                && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(type, format, required, nullable, union, items, requiredFields, fields);
    }

    @Override
    public String toString()
    {
        return "SchemaSummary{type=" + type + ", required=" + required + ", nullable=" + nullable + "}";
    }
}
