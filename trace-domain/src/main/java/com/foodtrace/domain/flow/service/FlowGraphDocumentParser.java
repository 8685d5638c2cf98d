package com.foodtrace.domain.flow.service;

import com.foodtrace.domain.flow.model.valobj.FlowEdge;
import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.domain.flow.model.valobj.FlowNode;
import com.foodtrace.domain.flow.model.valobj.NodeConfig;
import com.foodtrace.types.enums.NodeKindEnum;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts between the editor JSON document and {@link FlowGraph}.
 * <p>
 * Document shape: {@code {nodes:[{id, kind, label, config, parentId}], edges:[{id, source, target}]}}.
 * Editor nodes that keep kind, label and config under {@code data} (with {@code data.nodeType})
 * are accepted as well. Unknown kinds and config keys not allowed for the node kind are rejected.
 * </p>
 */
public final class FlowGraphDocumentParser {

    public static final String KEY_OPERATION = "operation";
    public static final String KEY_EXPECTED_DURATION_MINUTES = "expected_duration_minutes";
    public static final String KEY_GATE_REF = "gate_ref";
    public static final String KEY_CHECKLIST = "checklist";
    public static final String KEY_BLOCKING = "blocking";
    public static final String KEY_CCP = "ccp";
    public static final String KEY_MIN_TEMP_C = "min_temp_c";
    public static final String KEY_MAX_TEMP_C = "max_temp_c";
    public static final String KEY_MAX_LOOPS = "max_loops";

    private static final Map<NodeKindEnum, Set<String>> ALLOWED_CONFIG_KEYS = new EnumMap<>(NodeKindEnum.class);

    static {
        ALLOWED_CONFIG_KEYS.put(NodeKindEnum.START, Set.of());
        ALLOWED_CONFIG_KEYS.put(NodeKindEnum.END, Set.of());
        ALLOWED_CONFIG_KEYS.put(NodeKindEnum.GROUP, Set.of());
        ALLOWED_CONFIG_KEYS.put(NodeKindEnum.PROCESS, Set.of(KEY_OPERATION, KEY_EXPECTED_DURATION_MINUTES));
        ALLOWED_CONFIG_KEYS.put(NodeKindEnum.QC_GATE, Set.of(KEY_GATE_REF, KEY_CHECKLIST, KEY_BLOCKING, KEY_CCP));
        ALLOWED_CONFIG_KEYS.put(NodeKindEnum.BUFFER, Set.of(KEY_MIN_TEMP_C, KEY_MAX_TEMP_C));
        ALLOWED_CONFIG_KEYS.put(NodeKindEnum.REWORK, Set.of(KEY_MAX_LOOPS));
    }

    private FlowGraphDocumentParser() {
    }

    public static Set<String> allowedConfigKeys(NodeKindEnum kind) {
        return ALLOWED_CONFIG_KEYS.getOrDefault(kind, Collections.emptySet());
    }

    public static FlowGraph parse(Map<String, Object> document) {
        if (document == null || document.isEmpty()) {
            return FlowGraph.empty();
        }
        List<FlowNode> nodes = new ArrayList<>();
        for (Map<?, ?> node : asObjectList(document.get("nodes"), "nodes")) {
            nodes.add(parseNode(node));
        }
        List<FlowEdge> edges = new ArrayList<>();
        for (Map<?, ?> edge : asObjectList(document.get("edges"), "edges")) {
            edges.add(FlowEdge.of(trimToNull(edge.get("id")), trimToNull(edge.get("source")),
                    trimToNull(edge.get("target"))));
        }
        return FlowGraph.of(nodes, edges);
    }

    public static Map<String, Object> toDocument(FlowGraph graph) {
        Map<String, Object> document = new LinkedHashMap<>();
        List<Map<String, Object>> nodes = new ArrayList<>();
        List<Map<String, Object>> edges = new ArrayList<>();
        if (graph != null) {
            for (FlowNode node : graph.getNodes()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("id", node.id());
                item.put("kind", node.kind().getCode());
                item.put("label", node.label());
                item.put("config", configToMap(node.config()));
                if (node.parentId() != null) {
                    item.put("parentId", node.parentId());
                }
                nodes.add(item);
            }
            for (FlowEdge edge : graph.getEdges()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("id", edge.id());
                item.put("source", edge.source());
                item.put("target", edge.target());
                edges.add(item);
            }
        }
        document.put("nodes", nodes);
        document.put("edges", edges);
        return document;
    }

    private static FlowNode parseNode(Map<?, ?> node) {
        String id = trimToNull(node.get("id"));
        Map<?, ?> data = node.get("data") instanceof Map<?, ?> nested ? nested : Collections.emptyMap();

        String kindText = trimToNull(node.get("kind"));
        if (kindText == null) {
            kindText = trimToNull(data.get("nodeType"));
        }
        if (kindText == null) {
            throw new IllegalArgumentException("nodes.kind cannot be empty. nodeId=" + id);
        }
        NodeKindEnum kind = NodeKindEnum.fromText(kindText);

        Object label = node.containsKey("label") ? node.get("label") : data.get("label");
        Object config = node.containsKey("config") ? node.get("config") : data.get("config");
        Object parentId = node.containsKey("parentId") ? node.get("parentId") : node.get("parent_id");

        return new FlowNode(id, kind, labelText(label), parseConfig(id, kind, config), trimToNull(parentId));
    }

    private static NodeConfig parseConfig(String nodeId, NodeKindEnum kind, Object rawConfig) {
        if (rawConfig == null) {
            rawConfig = Collections.emptyMap();
        }
        if (!(rawConfig instanceof Map<?, ?> config)) {
            throw new IllegalArgumentException("nodes.config must be an object. nodeId=" + nodeId);
        }
        Set<String> allowed = allowedConfigKeys(kind);
        for (Object key : config.keySet()) {
            if (!allowed.contains(String.valueOf(key))) {
                throw new IllegalArgumentException("Config key '" + key + "' is not allowed for node kind "
                        + kind + ". nodeId=" + nodeId);
            }
        }
        return switch (kind) {
            case START, END, GROUP -> NodeConfig.empty();
            case PROCESS -> new NodeConfig.Process(trimToNull(config.get(KEY_OPERATION)),
                    toInteger(config.get(KEY_EXPECTED_DURATION_MINUTES), nodeId, KEY_EXPECTED_DURATION_MINUTES));
            case QC_GATE -> new NodeConfig.QcGate(trimToNull(config.get(KEY_GATE_REF)),
                    toStringList(config.get(KEY_CHECKLIST), nodeId),
                    toBoolean(config.get(KEY_BLOCKING)),
                    toBoolean(config.get(KEY_CCP)));
            case BUFFER -> new NodeConfig.Buffer(toDouble(config.get(KEY_MIN_TEMP_C), nodeId, KEY_MIN_TEMP_C),
                    toDouble(config.get(KEY_MAX_TEMP_C), nodeId, KEY_MAX_TEMP_C));
            case REWORK -> new NodeConfig.Rework(toInteger(config.get(KEY_MAX_LOOPS), nodeId, KEY_MAX_LOOPS));
        };
    }

    private static Map<String, Object> configToMap(NodeConfig config) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (config instanceof NodeConfig.Process process) {
            putIfNotNull(map, KEY_OPERATION, process.operation());
            putIfNotNull(map, KEY_EXPECTED_DURATION_MINUTES, process.expectedDurationMinutes());
        } else if (config instanceof NodeConfig.QcGate gate) {
            putIfNotNull(map, KEY_GATE_REF, gate.gateRef());
            map.put(KEY_CHECKLIST, new ArrayList<>(gate.checklist()));
            map.put(KEY_BLOCKING, gate.blocking());
            map.put(KEY_CCP, gate.ccp());
        } else if (config instanceof NodeConfig.Buffer buffer) {
            putIfNotNull(map, KEY_MIN_TEMP_C, buffer.minTempC());
            putIfNotNull(map, KEY_MAX_TEMP_C, buffer.maxTempC());
        } else if (config instanceof NodeConfig.Rework rework) {
            putIfNotNull(map, KEY_MAX_LOOPS, rework.maxLoops());
        }
        return map;
    }

    private static List<Map<?, ?>> asObjectList(Object value, String fieldName) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(fieldName + " must be an array");
        }
        List<Map<?, ?>> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException(fieldName + " elements must be objects");
            }
            result.add(map);
        }
        return result;
    }

    // Editor labels may be localized, e.g. {"en": "Start", "hu": "Kezdés"}.
    private static String labelText(Object label) {
        if (label instanceof Map<?, ?> localized) {
            Object english = localized.get("en");
            if (english != null) {
                return String.valueOf(english);
            }
            return localized.isEmpty() ? null : String.valueOf(localized.values().iterator().next());
        }
        return label == null ? null : String.valueOf(label);
    }

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static List<String> toStringList(Object value, String nodeId) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(KEY_CHECKLIST + " must be an array. nodeId=" + nodeId);
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            String text = trimToNull(item);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value).trim());
    }

    private static Integer toInteger(Object value, String nodeId, String key) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer. nodeId=" + nodeId, ex);
        }
    }

    private static Double toDouble(Object value, String nodeId, String key) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number. nodeId=" + nodeId, ex);
        }
    }

    private static String trimToNull(Object value) {
        return value == null ? null : StringUtils.trimToNull(String.valueOf(value));
    }
}
