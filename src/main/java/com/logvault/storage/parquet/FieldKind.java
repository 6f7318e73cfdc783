package com.logvault.storage.parquet;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.avro.Schema;

/**
 * Column kinds a JSON event field can be stored as.
 */
public enum FieldKind {
    BOOLEAN(Schema.Type.BOOLEAN),
    LONG(Schema.Type.LONG),
    DOUBLE(Schema.Type.DOUBLE),
    STRING(Schema.Type.STRING),
    /** objects and arrays, stored as JSON text */
    JSON(Schema.Type.STRING);

    private final Schema.Type avroType;

    FieldKind(Schema.Type avroType) {
        this.avroType = avroType;
    }

    /**
     * @return the kind of a non-null value, or null for JSON null / missing
     */
    public static FieldKind of(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isBoolean()) {
            return BOOLEAN;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return LONG;
        }
        if (value.isNumber()) {
            return DOUBLE;
        }
        if (value.isTextual()) {
            return STRING;
        }
        if (value.isContainerNode()) {
            return JSON;
        }
        // binary and POJO nodes never come out of a parsed HTTP body
        return STRING;
    }

    /**
     * Combine the kinds seen for one field while inferring the schema.
     *
     * @return the wider kind, or null if the two cannot share a column
     */
    static FieldKind merge(FieldKind current, FieldKind seen) {
        if (current == null) {
            return seen;
        }
        if (seen == null || current == seen) {
            return current;
        }
        if ((current == LONG && seen == DOUBLE) || (current == DOUBLE && seen == LONG)) {
            return DOUBLE;
        }
        return null;
    }

    public boolean accepts(JsonNode value) {
        FieldKind kind = of(value);
        return kind == null || kind == this || (this == DOUBLE && kind == LONG);
    }

    Object toAvro(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        switch (this) {
            case BOOLEAN:
                return value.booleanValue();
            case LONG:
                return value.longValue();
            case DOUBLE:
                return value.doubleValue();
            case JSON:
                return value.toString();
            default:
                return value.isTextual() ? value.textValue() : value.asText();
        }
    }

    Schema nullableAvroSchema() {
        return Schema.createUnion(Schema.create(Schema.Type.NULL), Schema.create(avroType));
    }
}
