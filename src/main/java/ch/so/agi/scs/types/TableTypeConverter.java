package ch.so.agi.scs.types;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import ch.so.agi.scs.model.ScgModelException;

/**
 * Map backed {@link ScgTypeConverter}. The default tables ship as the classpath resource
 * {@value #DEFAULT_RESOURCE}.
 */
public final class TableTypeConverter implements ScgTypeConverter {
    private static final Logger LOG = LoggerFactory.getLogger(TableTypeConverter.class);

    public static final String DEFAULT_RESOURCE = "/scg-types.json";

    private static volatile TableTypeConverter defaults;

    private final Map<String, String> nodeTypes;
    private final Map<String, String> connectorTypes;

    public TableTypeConverter(Map<String, String> nodeTypes, Map<String, String> connectorTypes) {
        this.nodeTypes = Collections.unmodifiableMap(new LinkedHashMap<>(nodeTypes));
        this.connectorTypes = Collections.unmodifiableMap(new LinkedHashMap<>(connectorTypes));
    }

    /** Tables from {@value #DEFAULT_RESOURCE}, loaded once. */
    public static TableTypeConverter defaults() {
        TableTypeConverter result = defaults;
        if (result == null) {
            synchronized (TableTypeConverter.class) {
                result = defaults;
                if (result == null) {
                    result = load(DEFAULT_RESOURCE);
                    defaults = result;
                }
            }
        }
        return result;
    }

    static TableTypeConverter load(String resource) {
        try (InputStream in = TableTypeConverter.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Type table resource not found: " + resource);
            }
            TableTypeConverter converter = parse(new InputStreamReader(in, StandardCharsets.UTF_8));
            LOG.debug("Loaded {} node and {} connector types from {}", converter.nodeTypes.size(),
                    converter.connectorTypes.size(), resource);
            return converter;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read type table " + resource, e);
        }
    }

    /** Reads {@code {"nodeTypes": {...}, "connectorTypes": {...}}}. */
    public static TableTypeConverter parse(Reader reader) {
        try {
            JsonElement je = JsonParser.parseReader(reader);
            if (!je.isJsonObject()) {
                throw new ScgModelException("Type table is not a JSON object");
            }
            JsonObject obj = je.getAsJsonObject();
            return new TableTypeConverter(toMap(obj, "nodeTypes"), toMap(obj, "connectorTypes"));
        } catch (JsonParseException e) {
            throw new ScgModelException("Malformed type table: " + e.getMessage(), e);
        }
    }

    /** Returns a converter whose entries are overridden by the given ones. */
    public TableTypeConverter withOverrides(Map<String, String> extraNodeTypes, Map<String, String> extraConnectorTypes) {
        if ((extraNodeTypes == null || extraNodeTypes.isEmpty())
                && (extraConnectorTypes == null || extraConnectorTypes.isEmpty())) {
            return this;
        }
        Map<String, String> nodes = new LinkedHashMap<>(nodeTypes);
        Map<String, String> connectors = new LinkedHashMap<>(connectorTypes);
        if (extraNodeTypes != null) {
            nodes.putAll(extraNodeTypes);
        }
        if (extraConnectorTypes != null) {
            connectors.putAll(extraConnectorTypes);
        }
        return new TableTypeConverter(nodes, connectors);
    }

    @Override
    public Optional<String> nodeTypeKeyword(String scgType) {
        return lookup(nodeTypes, scgType);
    }

    @Override
    public Optional<String> connectorDesignation(String scgType) {
        return lookup(connectorTypes, scgType);
    }

    private static Optional<String> lookup(Map<String, String> table, String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        String value = table.get(key);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static Map<String, String> toMap(JsonObject obj, String member) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!obj.has(member) || !obj.get(member).isJsonObject()) {
            return result;
        }
        for (Map.Entry<String, JsonElement> e : obj.getAsJsonObject(member).entrySet()) {
            if (e.getValue().isJsonPrimitive()) {
                result.put(e.getKey(), e.getValue().getAsString());
            }
        }
        return result;
    }
}
