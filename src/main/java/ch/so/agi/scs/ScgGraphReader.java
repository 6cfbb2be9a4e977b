package ch.so.agi.scs;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import ch.so.agi.scs.model.ElementTag;
import ch.so.agi.scs.model.ScgGraph;
import ch.so.agi.scs.model.ScgModelException;

/**
 * Reads an element model from JSON:
 *
 * <pre>
 * {
 *   "elements": [
 *     {"id": "n1", "tag": "node", "identifier": "a", "type": "node/const/perm/general"},
 *     {"id": "a1", "tag": "arc", "type": "arc/const/pos/perm", "source": "n1", "target": "n2"},
 *     {"id": "c1", "tag": "contour", "children": ["n1"]}
 *   ],
 *   "root": ["c1"]
 * }
 * </pre>
 *
 * References are element ids. {@code root} is optional.
 */
public final class ScgGraphReader {
    private ScgGraphReader() {
    }

    public static ScgGraph read(String json) {
        return read(new StringReader(json != null ? json : ""));
    }

    public static ScgGraph read(Reader reader) {
        JsonElement je;
        try {
            je = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new ScgModelException("Malformed model document: " + e.getMessage(), e);
        }
        if (!je.isJsonObject()) {
            throw new ScgModelException("Model document is not a JSON object");
        }
        JsonObject doc = je.getAsJsonObject();
        if (!doc.has("elements") || !doc.get("elements").isJsonArray()) {
            throw new ScgModelException("Model document has no 'elements' array");
        }

        ScgGraph.Builder builder = ScgGraph.builder();
        for (JsonElement item : doc.getAsJsonArray("elements")) {
            if (!item.isJsonObject()) {
                throw new ScgModelException("Element entry is not an object: " + item);
            }
            declare(builder, item.getAsJsonObject());
        }
        if (doc.has("root") && doc.get("root").isJsonArray()) {
            builder.root(strings(doc.getAsJsonArray("root")));
        }
        return builder.build();
    }

    private static void declare(ScgGraph.Builder builder, JsonObject obj) {
        String id = string(obj, "id");
        ElementTag tag = tag(id, string(obj, "tag"));
        String identifier = string(obj, "identifier");
        String type = string(obj, "type");

        switch (tag) {
        case NODE:
            builder.node(id, identifier, type);
            break;
        case LINK:
            builder.link(id, identifier, type, string(obj, "content"));
            break;
        case BUS:
            builder.bus(id, identifier, type);
            break;
        case ARC:
        case PAIR:
            String subject = string(obj, "subject");
            builder.connector(tag, id, identifier, type, string(obj, "source"), string(obj, "target"),
                    subject.isEmpty() ? null : subject);
            break;
        case CONTOUR:
            List<String> children = obj.has("children") && obj.get("children").isJsonArray()
                    ? strings(obj.getAsJsonArray("children"))
                    : List.of();
            builder.contour(id, identifier, type, children);
            break;
        default:
            throw new IllegalStateException("Unhandled tag " + tag);
        }
    }

    private static ElementTag tag(String id, String value) {
        try {
            return ElementTag.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ScgModelException("Unknown tag '" + value + "' of element '" + id + "'", e);
        }
    }

    private static String string(JsonObject obj, String member) {
        JsonElement value = obj.get(member);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : "";
    }

    private static List<String> strings(JsonArray array) {
        List<String> result = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            if (e.isJsonPrimitive()) {
                result.add(e.getAsString());
            }
        }
        return result;
    }
}
