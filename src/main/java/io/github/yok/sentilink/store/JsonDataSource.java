package io.github.yok.sentilink.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.exception.SourceException;
import io.github.yok.sentilink.model.Tabular;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads a JSON file whose root is an array of objects, or a single object read as one row.
 *
 * <p>
 * Columns are the union of the object keys in first-seen order; keys missing from an object are
 * {@code null}. Scalars keep their JSON type ({@link String}, {@link Long}, {@link Double},
 * {@link java.math.BigDecimal}, {@link Boolean}); nested objects and arrays are kept as JSON text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JsonDataSource implements DataSource {

    private final ObjectMapper mapper;

    public JsonDataSource(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Tabular read(SourceConfig config) {
        Path file = Path.of(config.getPath());
        if (!Files.isRegularFile(file)) {
            throw new SourceException(SourceException.Reason.NOT_FOUND,
                    "File not found: " + file);
        }

        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new SourceException(SourceException.Reason.FORMAT_ERROR,
                    "Malformed JSON in file: " + file + " (" + e.getOriginalMessage() + ")", e);
        } catch (IOException e) {
            throw new SourceException(SourceException.Reason.FORMAT_ERROR,
                    "Failed to read JSON file: " + file, e);
        }

        List<JsonNode> objects = new ArrayList<>();
        if (root != null && root.isArray()) {
            for (JsonNode element : root) {
                if (!element.isObject()) {
                    throw new SourceException(SourceException.Reason.FORMAT_ERROR,
                            "JSON array element is not an object in file: " + file);
                }
                objects.add(element);
            }
        } else if (root != null && root.isObject()) {
            objects.add(root);
        } else {
            throw new SourceException(SourceException.Reason.FORMAT_ERROR,
                    "JSON root must be an array of objects or an object: " + file);
        }

        Set<String> columns = new LinkedHashSet<>();
        for (JsonNode object : objects) {
            Iterator<String> names = object.fieldNames();
            while (names.hasNext()) {
                columns.add(names.next());
            }
        }
        Tabular.Builder builder = Tabular.builder(new ArrayList<>(columns));
        for (JsonNode object : objects) {
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                row.put(field.getKey(), toValue(field.getValue()));
            }
            builder.addRow(row);
        }
        Tabular dataset = builder.build();
        log.info("Loaded {} records from JSON: {}", dataset.size(), file);
        return dataset;
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.decimalValue();
        }
        if (node.isBigDecimal()) {
            return node.decimalValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.toString();
    }
}
