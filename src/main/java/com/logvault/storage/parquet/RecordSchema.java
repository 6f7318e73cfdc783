package com.logvault.storage.parquet;

import com.fasterxml.jackson.databind.JsonNode;
import com.logvault.storage.SchemaMismatchException;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The column layout of a run, fixed by the first non-empty batch of events.
 *
 * Columns are the union of the batch's field names in first-seen order, every one nullable.
 * Later records must carry exactly these fields with values of a compatible kind.
 */
public final class RecordSchema {

    static final String RECORD_NAME = "LogEvent";
    static final String NAMESPACE = "com.logvault.storage";
    static final String SOURCE_NAME_PROP = "source_name";

    private final List<Column> columns;
    private final Map<String, Column> bySourceName;
    private final Schema avroSchema;

    private RecordSchema(List<Column> columns) {
        this.columns = Collections.unmodifiableList(columns);
        this.bySourceName = new LinkedHashMap<>();
        for (Column column : columns) {
            bySourceName.put(column.sourceName, column);
        }
        this.avroSchema = buildAvroSchema(columns);
    }

    /**
     * @throws SchemaMismatchException if the batch is empty, has no fields, or uses one field with incompatible kinds
     */
    public static RecordSchema infer(List<? extends JsonNode> records) {
        if (records.isEmpty()) {
            throw new SchemaMismatchException("Cannot infer a schema from an empty batch", null);
        }
        Map<String, FieldKind> kinds = new LinkedHashMap<>();
        for (JsonNode record : records) {
            requireObject(record);
            Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                FieldKind seen = FieldKind.of(field.getValue());
                if (!kinds.containsKey(field.getKey())) {
                    kinds.put(field.getKey(), seen);
                    continue;
                }
                FieldKind current = kinds.get(field.getKey());
                FieldKind merged = FieldKind.merge(current, seen);
                if (merged == null) {
                    throw new SchemaMismatchException("Field '" + field.getKey() + "' holds both " + current
                        + " and " + seen + " values in the first batch", field.getKey());
                }
                kinds.put(field.getKey(), merged);
            }
        }
        if (kinds.isEmpty()) {
            throw new SchemaMismatchException("First batch of events carries no fields", null);
        }

        List<Column> columns = new ArrayList<>(kinds.size());
        Set<String> usedNames = new HashSet<>();
        for (Map.Entry<String, FieldKind> entry : kinds.entrySet()) {
            FieldKind kind = entry.getValue() != null ? entry.getValue() : FieldKind.STRING;
            String avroName = uniqueName(sanitize(entry.getKey()), usedNames);
            columns.add(new Column(entry.getKey(), avroName, kind));
        }
        return new RecordSchema(columns);
    }

    /**
     * Check one record against the schema.
     *
     * @param position index of the record within its batch, used in the error message
     */
    public void validate(JsonNode record, int position) {
        requireObject(record);
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Column column = bySourceName.get(field.getKey());
            if (column == null) {
                throw new SchemaMismatchException("Record " + position + " has field '" + field.getKey()
                    + "' which is not in the run schema " + bySourceName.keySet(), field.getKey());
            }
            if (!column.kind.accepts(field.getValue())) {
                throw new SchemaMismatchException("Record " + position + " field '" + field.getKey() + "' is "
                    + FieldKind.of(field.getValue()) + ", expected " + column.kind, field.getKey());
            }
        }
        for (Column column : columns) {
            if (!record.has(column.sourceName)) {
                throw new SchemaMismatchException("Record " + position + " is missing field '" + column.sourceName + "'",
                    column.sourceName);
            }
        }
    }

    GenericRecord toRecord(JsonNode record) {
        GenericRecord out = new GenericData.Record(avroSchema);
        for (Column column : columns) {
            out.put(column.avroName, column.kind.toAvro(record.get(column.sourceName)));
        }
        return out;
    }

    public Schema getAvroSchema() {
        return avroSchema;
    }

    public List<String> getFieldNames() {
        return new ArrayList<>(bySourceName.keySet());
    }

    public FieldKind kindOf(String sourceName) {
        Column column = bySourceName.get(sourceName);
        return column != null ? column.kind : null;
    }

    public String avroNameOf(String sourceName) {
        Column column = bySourceName.get(sourceName);
        return column != null ? column.avroName : null;
    }

    public int size() {
        return columns.size();
    }

    static String sanitize(String name) {
        if (name.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(name.length() + 1);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || (c >= '0' && c <= '9');
            sb.append(valid ? c : '_');
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    private static String uniqueName(String candidate, Set<String> used) {
        String name = candidate;
        int suffix = 2;
        while (!used.add(name)) {
            name = candidate + "_" + suffix++;
        }
        return name;
    }

    private static void requireObject(JsonNode record) {
        if (record == null || !record.isObject()) {
            throw new SchemaMismatchException("Expected a JSON object record but got "
                + (record == null ? "null" : record.getNodeType()), null);
        }
    }

    private static Schema buildAvroSchema(List<Column> columns) {
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(RECORD_NAME)
            .namespace(NAMESPACE)
            .fields();
        for (Column column : columns) {
            fields = fields.name(column.avroName)
                .prop(SOURCE_NAME_PROP, column.sourceName)
                .type(column.kind.nullableAvroSchema())
                .withDefault(null);
        }
        return fields.endRecord();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RecordSchema{");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(columns.get(i).sourceName).append(':').append(columns.get(i).kind);
        }
        return sb.append('}').toString();
    }

    private static final class Column {
        private final String sourceName;
        private final String avroName;
        private final FieldKind kind;

        private Column(String sourceName, String avroName, FieldKind kind) {
            this.sourceName = sourceName;
            this.avroName = avroName;
            this.kind = kind;
        }
    }
}
