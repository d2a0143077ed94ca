package io.github.yok.flexrecords.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flexrecords.model.ContentBatch;
import io.github.yok.flexrecords.model.DbReference;
import io.github.yok.flexrecords.model.ExistingMode;
import io.github.yok.flexrecords.model.ListValue;
import io.github.yok.flexrecords.model.LocalReference;
import io.github.yok.flexrecords.model.Nested;
import io.github.yok.flexrecords.model.RecordParams;
import io.github.yok.flexrecords.model.RecordValue;
import io.github.yok.flexrecords.model.TableBatch;
import io.github.yok.flexrecords.model.TableOptions;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link ContentBatch} from a JSON content file.
 *
 * <p>
 * The root object maps table names to objects of records keyed by local id. Field order, record
 * order and table order follow the file. Special keys:
 * </p>
 * <ul>
 * <li>{@code "__options"} in a table object: {@code {"existing": {"refColumns": [...],
 * "idColumn": "id" | [...], "mode": "insert" | "update" | "replace"}}}; the flags
 * {@code "update": true} and {@code "replace": true} are accepted instead of {@code mode}.</li>
 * <li>{@code {"$ref": {"table": "t", "id": "x"}}} as a value: local reference.</li>
 * <li>{@code {"$dbref": {"table": "t", "refColumns": [...], "idColumn": ..., "values": [...]}}}
 * as a value: database reference; {@code refColumns} defaults to {@code ["name"]} and
 * {@code idColumn} to {@code "id"}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class ContentBatchParser {

    static final String OPTIONS_KEY = "__options";
    static final String LOCAL_REF_KEY = "$ref";
    static final String DB_REF_KEY = "$dbref";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses a content file (UTF-8).
     *
     * @param file content file
     * @return content batch
     * @throws IOException if the file cannot be read or is not a valid content batch
     */
    public ContentBatch parse(File file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses content JSON.
     *
     * @param reader JSON source
     * @return content batch
     * @throws IOException if the source cannot be read or is not a valid content batch
     */
    public ContentBatch parse(Reader reader) throws IOException {
        JsonNode root = mapper.readTree(reader);
        if (root == null || !root.isObject()) {
            throw new ContentFormatException("$: content must be a JSON object of tables");
        }

        ContentBatch batch = new ContentBatch();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> table = it.next();
            batch.table(table.getKey(), parseTable(table.getKey(), table.getValue()));
        }
        return batch;
    }

    private TableBatch parseTable(String table, JsonNode node) throws ContentFormatException {
        String path = "$." + table;
        requireObject(node, path);

        TableBatch batch = new TableBatch();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            if (OPTIONS_KEY.equals(e.getKey())) {
                batch.options(parseOptions(e.getValue(), path + "." + OPTIONS_KEY));
                continue;
            }
            String recordPath = path + "." + e.getKey();
            requireObject(e.getValue(), recordPath);
            batch.record(e.getKey(), parseParams(e.getValue(), recordPath));
        }
        return batch;
    }

    private TableOptions parseOptions(JsonNode node, String path) throws ContentFormatException {
        requireObject(node, path);
        JsonNode existing = node.get("existing");
        if (existing == null || existing.isNull()) {
            return TableOptions.defaults();
        }
        String existingPath = path + ".existing";
        requireObject(existing, existingPath);

        List<String> refColumns = columns(existing.get("refColumns"), existingPath + ".refColumns");
        List<String> idColumns = columns(existing.get("idColumn"), existingPath + ".idColumn");
        return new TableOptions(refColumns, idColumns, parseMode(existing, existingPath));
    }

    private ExistingMode parseMode(JsonNode existing, String path) throws ContentFormatException {
        JsonNode mode = existing.get("mode");
        if (mode != null && !mode.isNull()) {
            switch (mode.asText().toLowerCase(Locale.ROOT)) {
                case "insert":
                    return ExistingMode.INSERT_ONLY;
                case "update":
                    return ExistingMode.UPDATE;
                case "replace":
                    return ExistingMode.REPLACE;
                default:
                    throw new ContentFormatException(
                            path + ".mode: unknown mode '" + mode.asText() + "'");
            }
        }
        if (existing.path("update").asBoolean(false)) {
            return ExistingMode.UPDATE;
        }
        if (existing.path("replace").asBoolean(false)) {
            return ExistingMode.REPLACE;
        }
        return ExistingMode.INSERT_ONLY;
    }

    private RecordParams parseParams(JsonNode node, String path) throws ContentFormatException {
        RecordParams params = new RecordParams();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            params.put(e.getKey(), parseValue(e.getValue(), path + "." + e.getKey()));
        }
        return params;
    }

    private RecordValue parseValue(JsonNode node, String path) throws ContentFormatException {
        if (node == null || node.isNull()) {
            return RecordValue.scalar(null);
        }
        if (node.isArray()) {
            List<RecordValue> items = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                items.add(parseValue(node.get(i), path + "[" + i + "]"));
            }
            return new ListValue(items);
        }
        if (node.isObject()) {
            if (node.size() == 1 && node.has(LOCAL_REF_KEY)) {
                return parseLocalRef(node.get(LOCAL_REF_KEY), path + "." + LOCAL_REF_KEY);
            }
            if (node.size() == 1 && node.has(DB_REF_KEY)) {
                return parseDbRef(node.get(DB_REF_KEY), path + "." + DB_REF_KEY);
            }
            return new Nested(parseParams(node, path));
        }
        if (node.isBoolean()) {
            return RecordValue.scalar(node.booleanValue());
        }
        if (node.isNumber()) {
            return RecordValue.scalar(node.numberValue());
        }
        return RecordValue.scalar(node.asText());
    }

    private LocalReference parseLocalRef(JsonNode node, String path)
            throws ContentFormatException {
        requireObject(node, path);
        return new LocalReference(requireText(node, "table", path), requireText(node, "id", path));
    }

    private DbReference parseDbRef(JsonNode node, String path) throws ContentFormatException {
        requireObject(node, path);
        String table = requireText(node, "table", path);
        List<String> refColumns = columns(node.get("refColumns"), path + ".refColumns");
        List<String> idColumns = columns(node.get("idColumn"), path + ".idColumn");

        JsonNode valuesNode = node.get("values");
        if (valuesNode == null) {
            throw new ContentFormatException(path + ".values: missing");
        }
        List<RecordValue> values = new ArrayList<>();
        if (valuesNode.isArray()) {
            for (int i = 0; i < valuesNode.size(); i++) {
                values.add(parseValue(valuesNode.get(i), path + ".values[" + i + "]"));
            }
        } else {
            values.add(parseValue(valuesNode, path + ".values"));
        }

        try {
            return new DbReference(table, refColumns.isEmpty() ? List.of("name") : refColumns,
                    idColumns.isEmpty() ? List.of(TableOptions.DEFAULT_ID_COLUMN) : idColumns,
                    values);
        } catch (IllegalArgumentException e) {
            throw new ContentFormatException(path + ": " + e.getMessage());
        }
    }

    /**
     * Reads a column name or an array of column names.
     *
     * @return column names; empty if the node is absent
     */
    private static List<String> columns(JsonNode node, String path) throws ContentFormatException {
        List<String> columns = new ArrayList<>();
        if (node == null || node.isNull()) {
            return columns;
        }
        if (node.isTextual()) {
            columns.add(node.textValue());
            return columns;
        }
        if (!node.isArray()) {
            throw new ContentFormatException(path + ": expected a column name or an array");
        }
        for (JsonNode c : node) {
            if (!c.isTextual() || c.textValue().isBlank()) {
                throw new ContentFormatException(path + ": column names must be non-blank text");
            }
            columns.add(c.textValue());
        }
        return columns;
    }

    private static String requireText(JsonNode node, String field, String path)
            throws ContentFormatException {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            throw new ContentFormatException(path + "." + field + ": missing");
        }
        return value.asText();
    }

    private static void requireObject(JsonNode node, String path) throws ContentFormatException {
        if (node == null || !node.isObject()) {
            throw new ContentFormatException(path + ": expected a JSON object");
        }
    }
}
