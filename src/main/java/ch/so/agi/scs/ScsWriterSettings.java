package ch.so.agi.scs;

import com.google.gson.*;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ScsWriterSettings {
    private static final Logger LOG = LoggerFactory.getLogger(ScsWriterSettings.class);

    static final String SECTION = "scg2scs";

    /**
     * Declare nodes of nested contours in the owning scope. When false, a node is declared inside
     * the body of the contour that contains it.
     */
    private boolean hoistContourNodes = true;

    /** Append nrel_main_idtf blocks for natural-language identifiers. */
    private boolean emitMainIdentifiers = true;

    /** Extra SCg node type to SCs keyword entries, overriding the built-in table. */
    private Map<String, String> nodeTypes = new LinkedHashMap<>();

    /** Extra SCg connector type to SCs designation entries, overriding the built-in table. */
    private Map<String, String> connectorTypes = new LinkedHashMap<>();

    public boolean isHoistContourNodes() {
        return hoistContourNodes;
    }

    public void setHoistContourNodes(boolean v) {
        this.hoistContourNodes = v;
    }

    public boolean isEmitMainIdentifiers() {
        return emitMainIdentifiers;
    }

    public void setEmitMainIdentifiers(boolean v) {
        this.emitMainIdentifiers = v;
    }

    public Map<String, String> getNodeTypes() {
        return Collections.unmodifiableMap(nodeTypes);
    }

    public void setNodeTypes(Map<String, String> v) {
        this.nodeTypes = v != null ? new LinkedHashMap<>(v) : new LinkedHashMap<>();
    }

    public Map<String, String> getConnectorTypes() {
        return Collections.unmodifiableMap(connectorTypes);
    }

    public void setConnectorTypes(Map<String, String> v) {
        this.connectorTypes = v != null ? new LinkedHashMap<>(v) : new LinkedHashMap<>();
    }

    @Override public String toString() {
        return "ScsWriterSettings{hoistContourNodes=" + hoistContourNodes
                + ", emitMainIdentifiers=" + emitMainIdentifiers
                + ", nodeTypes=" + nodeTypes.size()
                + ", connectorTypes=" + connectorTypes.size() + "}";
    }

    /** Build from a Map payload or anything whose string form is JSON. */
    public static ScsWriterSettings from(Object any) {
        ScsWriterSettings s = new ScsWriterSettings();
        if (any == null) return s;

        // ---- Map payloads ----
        if (any instanceof Map<?, ?> top) {
            Object section = top.containsKey(SECTION) ? top.get(SECTION) : top;
            if (section instanceof Map<?, ?> sec) {
                Object hoist = sec.get("hoistContourNodes");
                if (hoist != null) s.setHoistContourNodes(Boolean.parseBoolean(String.valueOf(hoist)));
                Object emit = sec.get("emitMainIdentifiers");
                if (emit != null) s.setEmitMainIdentifiers(Boolean.parseBoolean(String.valueOf(emit)));
                s.setNodeTypes(stringMap(sec.get("nodeTypes")));
                s.setConnectorTypes(stringMap(sec.get("connectorTypes")));
            }
            return s;
        }

        // ---- JSON payloads (Gson) ----
        try {
            JsonElement je = (any instanceof JsonElement) ? (JsonElement) any : JsonParser.parseString(any.toString());
            if (je.isJsonObject()) {
                JsonObject obj = je.getAsJsonObject();
                JsonObject sec = obj.has(SECTION) && obj.get(SECTION).isJsonObject()
                        ? obj.getAsJsonObject(SECTION)
                        : obj;

                if (sec.has("hoistContourNodes") && sec.get("hoistContourNodes").isJsonPrimitive()) {
                    s.setHoistContourNodes(sec.getAsJsonPrimitive("hoistContourNodes").getAsBoolean());
                }
                if (sec.has("emitMainIdentifiers") && sec.get("emitMainIdentifiers").isJsonPrimitive()) {
                    s.setEmitMainIdentifiers(sec.getAsJsonPrimitive("emitMainIdentifiers").getAsBoolean());
                }
                s.setNodeTypes(stringMap(sec, "nodeTypes"));
                s.setConnectorTypes(stringMap(sec, "connectorTypes"));
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            LOG.warn("Ignoring unreadable settings payload: {}", e.getMessage());
            return new ScsWriterSettings();
        }

        return s;
    }

    private static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    result.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
                }
            }
        }
        return result;
    }

    private static Map<String, String> stringMap(JsonObject sec, String member) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!sec.has(member) || !sec.get(member).isJsonObject()) {
            return result;
        }
        for (Map.Entry<String, JsonElement> e : sec.getAsJsonObject(member).entrySet()) {
            if (e.getValue().isJsonPrimitive()) {
                result.put(e.getKey(), e.getValue().getAsString());
            }
        }
        return result;
    }
}
