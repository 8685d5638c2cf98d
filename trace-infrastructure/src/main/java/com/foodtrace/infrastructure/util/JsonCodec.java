package com.foodtrace.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.domain.flow.service.FlowGraphDocumentParser;
import com.foodtrace.types.enums.ResponseCode;
import com.foodtrace.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Codec for the jsonb columns: {@code flow_versions.graph}, {@code qc_gates.checklist} and
 * {@code lots.metadata}. Failures name the column they came from.
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<Map<String, Object>>() {};
    private static final TypeReference<List<String>> CHECKLIST = new TypeReference<List<String>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Blank column reads as the empty graph.
     */
    public FlowGraph readGraph(String json) {
        if (StringUtils.isBlank(json)) {
            return FlowGraph.empty();
        }
        return FlowGraphDocumentParser.parse(read("flow_versions.graph", json, DOCUMENT));
    }

    public String writeGraph(FlowGraph graph) {
        return write("flow_versions.graph", FlowGraphDocumentParser.toDocument(graph == null ? FlowGraph.empty() : graph));
    }

    public List<String> readChecklist(String json) {
        if (StringUtils.isBlank(json)) {
            return List.of();
        }
        List<String> items = read("qc_gates.checklist", json, CHECKLIST);
        return items == null ? List.of() : List.copyOf(items);
    }

    public String writeChecklist(List<String> checklist) {
        return write("qc_gates.checklist", checklist == null ? List.of() : checklist);
    }

    /**
     * @return null when the lot carries no metadata
     */
    public Map<String, Object> readMetadata(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        return read("lots.metadata", json, DOCUMENT);
    }

    public String writeMetadata(Map<String, Object> metadata) {
        return metadata == null ? null : write("lots.metadata", metadata);
    }

    private <T> T read(String column, String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Unreadable json in " + column, ex);
        }
    }

    private String write(String column, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Cannot write json for " + column, ex);
        }
    }
}
