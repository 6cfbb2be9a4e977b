package ch.so.agi.scs.writer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import ch.so.agi.scs.model.ElementTag;
import ch.so.agi.scs.model.ScgElement;
import ch.so.agi.scs.model.ScgGraph;

/**
 * Turns raw SCg identifiers into legal SCs system identifiers.
 * <p>
 * A raw identifier that is not a plain ASCII identifier is dropped and a name is generated from the
 * element id; if the dropped text is natural language it is kept as main identifier. Variables get
 * a leading underscore. Connectors always become anonymous aliases.
 */
public final class ScsIdentifierResolver {
    static final String VAR_MARKER = "var";
    static final String ALIAS_PREFIX = "##";
    static final String CONNECTOR_PREFIX = "connector";
    static final String UNDERSCORE = "_";

    private final Pattern systemIdentifierPattern = Pattern.compile("^[0-9a-zA-Z_]*$");
    private final Pattern naturalLanguagePattern = Pattern.compile("^[0-9a-zA-Z_\\u0400-\\u045F*' ]*$");
    private final Pattern illegalCharacters = Pattern.compile("[^0-9a-zA-Z_]");

    public ScsIdentifierTable resolveAll(ScgGraph graph) {
        Objects.requireNonNull(graph, "ScgGraph is null");
        List<ScsIdentifier> identifiers = new ArrayList<>(graph.size());
        for (ScgElement element : graph.getElements()) {
            identifiers.add(resolve(element));
        }
        return new ScsIdentifierTable(identifiers);
    }

    public ScsIdentifier resolve(ScgElement element) {
        Objects.requireNonNull(element, "element is null");
        String candidate = element.getIdentifier();
        boolean isVar = isVariable(element.getType());
        String mainIdentifier = "";

        if (!isSystemIdentifier(candidate)) {
            if (isNaturalLanguageIdentifier(candidate) && !candidate.isBlank()) {
                mainIdentifier = candidate;
            }
            candidate = "";
        }

        String systemIdentifier;
        if (candidate.isEmpty()) {
            String prefix = kindPrefix(element.getTag());
            systemIdentifier = (isVar ? UNDERSCORE + prefix : prefix) + UNDERSCORE + normalizeId(element.getId());
        } else if (isVar && !candidate.startsWith(UNDERSCORE)) {
            systemIdentifier = UNDERSCORE + candidate;
        } else {
            systemIdentifier = candidate;
        }

        if (element.getTag().isConnector()) {
            return new ScsIdentifier(makeAlias(CONNECTOR_PREFIX, element.getId()), "");
        }
        return new ScsIdentifier(systemIdentifier, mainIdentifier);
    }

    public boolean isSystemIdentifier(String identifier) {
        return systemIdentifierPattern.matcher(identifier).matches();
    }

    public boolean isNaturalLanguageIdentifier(String identifier) {
        return naturalLanguagePattern.matcher(identifier).matches();
    }

    public static boolean isVariable(String elementType) {
        return elementType != null && elementType.contains(VAR_MARKER);
    }

    String makeAlias(String prefix, String elementId) {
        return ALIAS_PREFIX + prefix + UNDERSCORE + normalizeId(elementId);
    }

    /** Dashes and anything else outside {@code [0-9a-zA-Z_]} become underscores. */
    String normalizeId(String elementId) {
        return illegalCharacters.matcher(elementId).replaceAll(UNDERSCORE);
    }

    /** Prefix of generated names; the serializer uses the same prefixes for its fallbacks. */
    static String kindPrefix(ElementTag tag) {
        switch (tag) {
        case CONTOUR:
            return "contour";
        case BUS:
            return "bus";
        case ARC:
        case PAIR:
            return CONNECTOR_PREFIX;
        default:
            return "node";
        }
    }
}
