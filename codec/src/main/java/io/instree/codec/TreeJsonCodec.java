package io.instree.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.instree.core.InstanceId;
import io.instree.core.InstanceTree;
import io.instree.core.RootedInstance;
import io.instree.core.TraversalOrder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON representation of an {@link InstanceTree}.
 * <p>
 * Format:
 * <pre>
 * {
 *   "instances": {
 *     "&lt;id&gt;": { ...payload fields..., "Id": "&lt;id&gt;", "Children": ["&lt;id&gt;", ...], "Parent": "&lt;id&gt;" | null }
 *   },
 *   "root_ids": ["&lt;id&gt;", ...]
 * }
 * </pre>
 * The payload is serialized with Jackson and its fields are flattened into the
 * instance object, so it must serialize to a JSON object and must not use the
 * structural keys {@code Id}, {@code Children} or {@code Parent}.
 * <p>
 * Writing is deterministic: roots in root-set order, each followed by its
 * descendants in pre-order, child-list order.
 * <p>
 * Reading validates the whole document first, then rebuilds the tree through
 * {@link InstanceTree#insertInstance}. Instances therefore get fresh ids; the
 * shape, child order and payloads are preserved.
 *
 * @param <P> payload type
 */
public final class TreeJsonCodec<P> {
    private static final Logger log = Logger.getLogger(TreeJsonCodec.class.getName());

    static final String INSTANCES = "instances";
    static final String ROOT_IDS = "root_ids";
    static final String ID = "Id";
    static final String CHILDREN = "Children";
    static final String PARENT = "Parent";

    private static final Set<String> STRUCTURAL_KEYS = Set.of(ID, CHILDREN, PARENT);

    private final ObjectMapper mapper;
    private final Class<P> payloadType;

    public TreeJsonCodec(Class<P> payloadType) {
        this(new ObjectMapper(), payloadType);
    }

    public TreeJsonCodec(ObjectMapper mapper, Class<P> payloadType) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
    }

    /** Codec for document trees of {@link Instance} payloads. */
    public static TreeJsonCodec<Instance> forInstances() {
        return new TreeJsonCodec<>(Instance.class);
    }

    // ---------- writing ----------

    /** Build the JSON document for {@code tree}. */
    public ObjectNode write(InstanceTree<P> tree) {
        ObjectNode doc = mapper.createObjectNode();
        ObjectNode instances = doc.putObject(INSTANCES);
        ArrayNode roots = doc.putArray(ROOT_IDS);

        for (InstanceId rootId : tree.getRootIds()) {
            roots.add(rootId.toString());
            tree.descendants(rootId, TraversalOrder.CHILD_ORDER)
                    .forEachRemaining(inst -> instances.set(inst.id().toString(), encodeInstance(inst)));
        }
        return doc;
    }

    public String writeString(InstanceTree<P> tree, boolean pretty) {
        try {
            ObjectNode doc = write(tree);
            return pretty
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(doc)
                    : mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void write(InstanceTree<P> tree, Path path) {
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), write(tree));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write tree to " + path, e);
        }
    }

    private ObjectNode encodeInstance(RootedInstance<P> inst) {
        JsonNode payload = mapper.valueToTree(inst.payload());
        if (!(payload instanceof ObjectNode node)) {
            throw new TreeFormatException("Payload of " + inst.id() + " does not serialize to a JSON object");
        }
        for (String key : STRUCTURAL_KEYS) {
            if (node.has(key)) {
                throw new TreeFormatException("Payload of " + inst.id() + " uses reserved key " + key);
            }
        }

        node.put(ID, inst.id().toString());
        ArrayNode children = node.putArray(CHILDREN);
        inst.childIds().forEach(c -> children.add(c.toString()));
        inst.parentId().ifPresentOrElse(p -> node.put(PARENT, p.toString()), () -> node.putNull(PARENT));
        return node;
    }

    // ---------- reading ----------

    public ImportedTree<P> read(String json) {
        try {
            // Duplicate object keys would otherwise collapse to the last one.
            return read(mapper.reader().with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION).readTree(json));
        } catch (JsonProcessingException e) {
            throw new TreeFormatException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ImportedTree<P> read(Path path) {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tree from " + path, e);
        }
        return read(json);
    }

    public ImportedTree<P> read(JsonNode doc) {
        if (doc == null || !doc.isObject()) throw new TreeFormatException("Document must be a JSON object");
        JsonNode instancesNode = doc.get(INSTANCES);
        JsonNode rootsNode = doc.get(ROOT_IDS);
        if (instancesNode == null || !instancesNode.isObject()) throw new TreeFormatException("Missing object '" + INSTANCES + "'");
        if (rootsNode == null || !rootsNode.isArray()) throw new TreeFormatException("Missing array '" + ROOT_IDS + "'");

        Map<InstanceId, Parsed<P>> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = instancesNode.fields();
        while (fields.hasNext()) {
            var e = fields.next();
            InstanceId key = parseId(e.getKey(), "instance key");
            if (parsed.put(key, decodeInstance(key, e.getValue())) != null) {
                throw new TreeFormatException("Instance " + key + " listed twice");
            }
        }

        Set<InstanceId> rootIds = new LinkedHashSet<>();
        for (JsonNode r : rootsNode) {
            InstanceId rootId = parseId(r, "root id");
            if (!rootIds.add(rootId)) throw new TreeFormatException("Root " + rootId + " listed twice");
            Parsed<P> root = parsed.get(rootId);
            if (root == null) throw new TreeFormatException("Root " + rootId + " is not among the instances");
            if (root.parent() != null) throw new TreeFormatException("Root " + rootId + " has parent " + root.parent());
        }

        validateLinks(parsed, rootIds);
        ImportedTree<P> imported = rebuild(parsed, rootIds);
        log.log(Level.FINE, () -> "Read tree document: " + imported.tree().size() + " instances, "
                + rootIds.size() + " roots");
        return imported;
    }

    private Parsed<P> decodeInstance(InstanceId key, JsonNode value) {
        if (!(value instanceof ObjectNode node)) throw new TreeFormatException("Instance " + key + " must be an object");

        InstanceId id = parseId(node.get(ID), ID + " of " + key);
        if (!id.equals(key)) throw new TreeFormatException("Instance " + key + " carries " + ID + " " + id);

        JsonNode parentNode = node.get(PARENT);
        InstanceId parent = parentNode == null || parentNode.isNull() ? null : parseId(parentNode, PARENT + " of " + key);

        JsonNode childrenNode = node.get(CHILDREN);
        List<InstanceId> children = new ArrayList<>();
        if (childrenNode != null && !childrenNode.isNull()) {
            if (!childrenNode.isArray()) throw new TreeFormatException(CHILDREN + " of " + key + " must be an array");
            for (JsonNode c : childrenNode) {
                children.add(parseId(c, "child of " + key));
            }
        }

        ObjectNode payloadNode = node.deepCopy();
        payloadNode.remove(STRUCTURAL_KEYS);
        P payload;
        try {
            payload = mapper.treeToValue(payloadNode, payloadType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TreeFormatException("Invalid payload for instance " + key + ": " + e.getMessage(), e);
        }
        if (payload == null) throw new TreeFormatException("Instance " + key + " has no payload");
        return new Parsed<>(parent, List.copyOf(children), payload);
    }

    /** Both directions of every link must agree, and every parentless instance must be a root. */
    private static <P> void validateLinks(Map<InstanceId, Parsed<P>> parsed, Set<InstanceId> rootIds) {
        for (var e : parsed.entrySet()) {
            InstanceId id = e.getKey();
            Parsed<P> inst = e.getValue();

            if (inst.parent() == null) {
                if (!rootIds.contains(id)) throw new TreeFormatException("Parentless instance " + id + " is not a root");
            } else {
                Parsed<P> parent = parsed.get(inst.parent());
                if (parent == null) throw new TreeFormatException("Instance " + id + " has unknown parent " + inst.parent());
                if (!parent.children().contains(id)) {
                    throw new TreeFormatException("Parent " + inst.parent() + " does not list child " + id);
                }
            }

            Set<InstanceId> seen = new HashSet<>();
            for (InstanceId childId : inst.children()) {
                if (!seen.add(childId)) throw new TreeFormatException("Instance " + id + " lists child " + childId + " twice");
                Parsed<P> child = parsed.get(childId);
                if (child == null) throw new TreeFormatException("Instance " + id + " lists unknown child " + childId);
                if (!id.equals(child.parent())) {
                    throw new TreeFormatException("Child " + childId + " of " + id + " names parent " + child.parent());
                }
            }
        }
    }

    /**
     * Insert roots, then children level by level in child-list order, so each
     * parent exists before its children and child order is kept.
     */
    private static <P> ImportedTree<P> rebuild(Map<InstanceId, Parsed<P>> parsed, Set<InstanceId> rootIds) {
        var tree = new InstanceTree<P>();
        Map<InstanceId, InstanceId> mapping = new LinkedHashMap<>();
        Deque<InstanceId> queue = new ArrayDeque<>();

        for (InstanceId rootId : rootIds) {
            mapping.put(rootId, tree.insertInstance(parsed.get(rootId).payload()));
            queue.add(rootId);
        }
        while (!queue.isEmpty()) {
            InstanceId oldId = queue.poll();
            InstanceId newParent = mapping.get(oldId);
            for (InstanceId childId : parsed.get(oldId).children()) {
                mapping.put(childId, tree.insertInstance(parsed.get(childId).payload(), newParent));
                queue.add(childId);
            }
        }

        // Links agree, so anything not reached from a root sits on a parent cycle.
        if (mapping.size() != parsed.size()) {
            var unreachable = new ArrayList<>(parsed.keySet());
            unreachable.removeAll(mapping.keySet());
            throw new TreeFormatException("Instances not reachable from any root (cycle): " + unreachable);
        }
        return new ImportedTree<>(tree, mapping);
    }

    private static InstanceId parseId(JsonNode node, String what) {
        if (node == null || !node.isTextual()) throw new TreeFormatException(what + " must be a string id");
        return parseId(node.asText(), what);
    }

    private static InstanceId parseId(String text, String what) {
        try {
            return InstanceId.parse(text);
        } catch (IllegalArgumentException e) {
            throw new TreeFormatException("Invalid " + what + ": '" + text + "'", e);
        }
    }

    private record Parsed<P>(InstanceId parent, List<InstanceId> children, P payload) {}
}
