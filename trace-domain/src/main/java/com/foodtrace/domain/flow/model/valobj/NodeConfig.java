package com.foodtrace.domain.flow.model.valobj;

import com.foodtrace.types.enums.NodeKindEnum;

import java.util.List;

/**
 * Per-kind node configuration. Each variant declares which node kinds it can be attached to.
 */
public interface NodeConfig {

    boolean appliesTo(NodeKindEnum kind);

    static NodeConfig empty() {
        return Empty.INSTANCE;
    }

    /**
     * Config with every optional field unset, for the given kind.
     */
    static NodeConfig defaultFor(NodeKindEnum kind) {
        return switch (kind) {
            case START, END, GROUP -> Empty.INSTANCE;
            case PROCESS -> new Process(null, null);
            case QC_GATE -> new QcGate(null, List.of(), false, false);
            case BUFFER -> new Buffer(null, null);
            case REWORK -> new Rework(null);
        };
    }

    /**
     * START, END and GROUP carry no configuration.
     */
    record Empty() implements NodeConfig {

        static final Empty INSTANCE = new Empty();

        @Override
        public boolean appliesTo(NodeKindEnum kind) {
            return kind == NodeKindEnum.START || kind == NodeKindEnum.END || kind == NodeKindEnum.GROUP;
        }
    }

    record Process(String operation, Integer expectedDurationMinutes) implements NodeConfig {

        @Override
        public boolean appliesTo(NodeKindEnum kind) {
            return kind == NodeKindEnum.PROCESS;
        }
    }

    /**
     * @param gateRef   gate number or name of the registered QC gate this node inspects at
     * @param checklist inspection items, never null
     * @param blocking  a non-PASS decision stops the run
     * @param ccp       critical control point, implies blocking
     */
    record QcGate(String gateRef, List<String> checklist, boolean blocking, boolean ccp) implements NodeConfig {

        public QcGate {
            checklist = checklist == null ? List.of() : List.copyOf(checklist);
        }

        @Override
        public boolean appliesTo(NodeKindEnum kind) {
            return kind == NodeKindEnum.QC_GATE;
        }
    }

    record Buffer(Double minTempC, Double maxTempC) implements NodeConfig {

        @Override
        public boolean appliesTo(NodeKindEnum kind) {
            return kind == NodeKindEnum.BUFFER;
        }
    }

    record Rework(Integer maxLoops) implements NodeConfig {

        @Override
        public boolean appliesTo(NodeKindEnum kind) {
            return kind == NodeKindEnum.REWORK;
        }
    }
}
