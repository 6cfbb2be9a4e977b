package ch.so.agi.scs.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Arena owning all elements of one SCg model. Elements reference each other by index, so the
 * graph may share elements between scopes (a node inside a contour that is also an endpoint of
 * an outer connector) without any ownership questions.
 */
public final class ScgGraph {
    private final List<ScgElement> elements;
    private final Map<String, Integer> indexById;
    private final List<Integer> root;

    private ScgGraph(List<ScgElement> elements, Map<String, Integer> indexById, List<Integer> root) {
        this.elements = Collections.unmodifiableList(elements);
        this.indexById = Collections.unmodifiableMap(indexById);
        this.root = List.copyOf(root);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return elements.size();
    }

    public ScgElement get(int index) {
        return elements.get(index);
    }

    public Optional<ScgElement> find(String id) {
        Integer index = id != null ? indexById.get(id) : null;
        return index != null ? Optional.of(elements.get(index)) : Optional.empty();
    }

    /** All elements in insertion order. */
    public List<ScgElement> getElements() {
        return elements;
    }

    /** Top-level scope. */
    public List<ScgElement> getRootScope() {
        return scope(root);
    }

    public List<ScgElement> getChildren(ScgContour contour) {
        return scope(contour.getChildren());
    }

    public ScgElement getSource(ScgConnector connector) {
        return elements.get(connector.getSource());
    }

    public ScgElement getTarget(ScgConnector connector) {
        return elements.get(connector.getTarget());
    }

    private List<ScgElement> scope(List<Integer> indices) {
        List<ScgElement> result = new ArrayList<>(indices.size());
        for (Integer index : indices) {
            result.add(elements.get(index));
        }
        return result;
    }

    /**
     * Collects element declarations by id and resolves the references when {@link #build()} is
     * called, so connectors and contours may mention elements declared later. A contour that
     * contains itself, directly or through nested contours, is rejected at build time.
     */
    public static final class Builder {
        private final Map<String, Declaration> declarations = new LinkedHashMap<>();
        private List<String> rootIds;

        private Builder() {
        }

        public Builder node(String id, String identifier, String type) {
            return declare(new Declaration(ElementTag.NODE, id, identifier, type));
        }

        public Builder link(String id, String identifier, String type, String content) {
            Declaration d = new Declaration(ElementTag.LINK, id, identifier, type);
            d.content = content;
            return declare(d);
        }

        public Builder bus(String id, String identifier, String type) {
            return declare(new Declaration(ElementTag.BUS, id, identifier, type));
        }

        public Builder arc(String id, String type, String sourceId, String targetId) {
            return connector(ElementTag.ARC, id, "", type, sourceId, targetId, null);
        }

        public Builder pair(String id, String type, String sourceId, String targetId) {
            return connector(ElementTag.PAIR, id, "", type, sourceId, targetId, null);
        }

        /**
         * Declares an arc or pair. {@code subjectId} may be null, in which case the source is the
         * subject.
         */
        public Builder connector(ElementTag tag, String id, String identifier, String type, String sourceId,
                String targetId, String subjectId) {
            Objects.requireNonNull(tag, "tag is null");
            if (!tag.isConnector()) {
                throw new IllegalArgumentException("Not a connector tag: " + tag);
            }
            Declaration d = new Declaration(tag, id, identifier, type);
            d.source = sourceId;
            d.target = targetId;
            d.subject = subjectId;
            return declare(d);
        }

        public Builder contour(String id, String identifier, String type, String... childIds) {
            return contour(id, identifier, type, Arrays.asList(childIds));
        }

        public Builder contour(String id, String identifier, String type, List<String> childIds) {
            Declaration d = new Declaration(ElementTag.CONTOUR, id, identifier, type);
            d.children = new ArrayList<>(childIds != null ? childIds : List.of());
            return declare(d);
        }

        /**
         * Sets the top-level scope explicitly. Without it, every element that is not a child of
         * some contour is top-level.
         */
        public Builder root(String... ids) {
            return root(Arrays.asList(ids));
        }

        public Builder root(List<String> ids) {
            this.rootIds = new ArrayList<>(ids);
            return this;
        }

        private Builder declare(Declaration d) {
            if (d.id == null || d.id.isBlank()) {
                throw new ScgModelException("Element without id: " + d.tag);
            }
            if (declarations.containsKey(d.id)) {
                throw new ScgModelException("Duplicate element id '" + d.id + "'");
            }
            declarations.put(d.id, d);
            return this;
        }

        public ScgGraph build() {
            Map<String, Integer> indexById = new LinkedHashMap<>();
            for (String id : declarations.keySet()) {
                indexById.put(id, indexById.size());
            }

            List<ScgElement> elements = new ArrayList<>(declarations.size());
            BitSet contained = new BitSet();
            for (Declaration d : declarations.values()) {
                int index = elements.size();
                switch (d.tag) {
                case NODE:
                    elements.add(new ScgNode(index, d.id, d.identifier, d.type));
                    break;
                case LINK:
                    elements.add(new ScgLink(index, d.id, d.identifier, d.type, d.content));
                    break;
                case BUS:
                    elements.add(new ScgBus(index, d.id, d.identifier, d.type));
                    break;
                case ARC:
                case PAIR:
                    int source = resolve(indexById, d.source, "source of connector " + d.id);
                    int target = resolve(indexById, d.target, "target of connector " + d.id);
                    int subject = d.subject != null
                            ? resolve(indexById, d.subject, "subject of connector " + d.id)
                            : source;
                    if (subject != source && subject != target) {
                        throw new ScgModelException("Subject '" + d.subject + "' of connector " + d.id
                                + " is neither its source nor its target");
                    }
                    elements.add(new ScgConnector(index, d.tag, d.id, d.identifier, d.type, source, target,
                            subject));
                    break;
                case CONTOUR:
                    List<Integer> children = new ArrayList<>(d.children.size());
                    for (String childId : d.children) {
                        int child = resolve(indexById, childId, "child of contour " + d.id);
                        children.add(child);
                        contained.set(child);
                    }
                    elements.add(new ScgContour(index, d.id, d.identifier, d.type, children));
                    break;
                default:
                    throw new IllegalStateException("Unhandled tag " + d.tag);
                }
            }

            rejectContourCycles(elements);

            List<Integer> root = new ArrayList<>();
            if (rootIds != null) {
                for (String id : rootIds) {
                    root.add(resolve(indexById, id, "root element"));
                }
            } else {
                for (int i = 0; i < elements.size(); i++) {
                    if (!contained.get(i)) {
                        root.add(i);
                    }
                }
            }
            return new ScgGraph(elements, indexById, root);
        }

        private static void rejectContourCycles(List<ScgElement> elements) {
            BitSet done = new BitSet();
            BitSet onPath = new BitSet();
            for (ScgElement element : elements) {
                if (element instanceof ScgContour contour) {
                    visitContour(elements, contour, done, onPath);
                }
            }
        }

        private static void visitContour(List<ScgElement> elements, ScgContour contour, BitSet done,
                BitSet onPath) {
            int index = contour.getIndex();
            if (onPath.get(index)) {
                throw new ScgModelException("Contour '" + contour.getId() + "' contains itself");
            }
            if (done.get(index)) {
                return;
            }
            onPath.set(index);
            for (Integer child : contour.getChildren()) {
                if (elements.get(child) instanceof ScgContour nested) {
                    visitContour(elements, nested, done, onPath);
                }
            }
            onPath.clear(index);
            done.set(index);
        }

        private static int resolve(Map<String, Integer> indexById, String id, String role) {
            if (id == null || id.isBlank()) {
                throw new ScgModelException("Missing reference: " + role);
            }
            Integer index = indexById.get(id);
            if (index == null) {
                throw new ScgModelException("Unknown element '" + id + "' referenced as " + role);
            }
            return index;
        }
    }

    private static final class Declaration {
        final ElementTag tag;
        final String id;
        final String identifier;
        final String type;
        String content;
        String source;
        String target;
        String subject;
        List<String> children = List.of();

        Declaration(ElementTag tag, String id, String identifier, String type) {
            this.tag = tag;
            this.id = id;
            this.identifier = identifier;
            this.type = type;
        }
    }
}
