package com.foodtrace.test.domain;

import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.domain.flow.model.valobj.FlowNode;
import com.foodtrace.domain.flow.model.valobj.NodeConfig;
import com.foodtrace.domain.flow.service.FlowGraphDocumentParser;
import com.foodtrace.test.support.FlowGraphFixtures;
import com.foodtrace.types.enums.NodeKindEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class FlowGraphDocumentParserTest {

    @Test
    public void shouldParseTypedConfigPerKind() {
        Map<String, Object> document = Map.of(
                "nodes", List.of(
                        Map.of("id", "qc", "kind", "QC_GATE", "label", "Metal detection",
                                "config", Map.of("gate_ref", "3", "checklist", List.of("ferrous", "non-ferrous"),
                                        "blocking", true, "ccp", "true")),
                        Map.of("id", "chill", "kind", "buffer",
                                "config", Map.of("min_temp_c", 0, "max_temp_c", "4.5"))),
                "edges", List.of(Map.of("id", "e1", "source", "qc", "target", "chill")));

        FlowGraph graph = FlowGraphDocumentParser.parse(document);

        FlowNode qc = graph.getNodes().get(0);
        Assertions.assertEquals(NodeKindEnum.QC_GATE, qc.kind());
        NodeConfig.QcGate gate = (NodeConfig.QcGate) qc.config();
        Assertions.assertEquals("3", gate.gateRef());
        Assertions.assertEquals(List.of("ferrous", "non-ferrous"), gate.checklist());
        Assertions.assertTrue(gate.blocking());
        Assertions.assertTrue(gate.ccp());

        NodeConfig.Buffer buffer = (NodeConfig.Buffer) graph.getNodes().get(1).config();
        Assertions.assertEquals(0.0, buffer.minTempC());
        Assertions.assertEquals(4.5, buffer.maxTempC());
        Assertions.assertEquals("chill", graph.getEdges().get(0).target());
    }

    @Test
    public void shouldRejectConfigKeyNotAllowedForKind() {
        Map<String, Object> document = Map.of(
                "nodes", List.of(Map.of("id", "start", "kind", "START", "config", Map.of("operation", "x"))));

        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> FlowGraphDocumentParser.parse(document));
        Assertions.assertTrue(ex.getMessage().contains("operation"));
    }

    @Test
    public void shouldRejectUnknownNodeKind() {
        Map<String, Object> document = Map.of("nodes", List.of(Map.of("id", "x", "kind", "TELEPORT")));

        Assertions.assertThrows(IllegalArgumentException.class, () -> FlowGraphDocumentParser.parse(document));
    }

    @Test
    public void shouldReadEditorNodeDataAndLocalizedLabel() {
        Map<String, Object> document = Map.of(
                "nodes", List.of(Map.of("id", "mix", "parent_id", "lane",
                        "data", Map.of("nodeType", "PROCESS", "label", Map.of("hu", "Keverés", "en", "Mixing"),
                                "config", Map.of("operation", "mix", "expected_duration_minutes", "45")))));

        FlowNode node = FlowGraphDocumentParser.parse(document).getNodes().get(0);

        Assertions.assertEquals(NodeKindEnum.PROCESS, node.kind());
        Assertions.assertEquals("Mixing", node.label());
        Assertions.assertEquals("lane", node.parentId());
        Assertions.assertEquals(new NodeConfig.Process("mix", 45), node.config());
    }

    @Test
    public void shouldProduceDocumentThatParsesBackToSameGraph() {
        FlowGraph graph = FlowGraphFixtures.withQcGate();

        Assertions.assertEquals(graph, FlowGraphDocumentParser.parse(FlowGraphDocumentParser.toDocument(graph)));
    }

    @Test
    public void shouldTreatMissingDocumentAsEmptyGraph() {
        Assertions.assertTrue(FlowGraphDocumentParser.parse(null).isEmpty());
        Assertions.assertTrue(FlowGraphDocumentParser.parse(Map.of()).isEmpty());
    }
}
