package com.golizard.termgraph.service;

import lombok.Getter;

/**
 * 边界标记结果：成功（标记数）或断连（起点 + 类别）
 *
 * 断连是可预期的结果，由编排器通过修复重试处理
 */
@Getter
public final class BoundaryMarkingResult {
    private final boolean disconnected;
    private final int markedCount;
    private final String startNode;
    private final String ontology;

    private BoundaryMarkingResult(boolean disconnected, int markedCount, String startNode, String ontology) {
        this.disconnected = disconnected;
        this.markedCount = markedCount;
        this.startNode = startNode;
        this.ontology = ontology;
    }

    public static BoundaryMarkingResult marked(int markedCount) {
        return new BoundaryMarkingResult(false, markedCount, null, null);
    }

    public static BoundaryMarkingResult disconnected(String startNode, String ontology) {
        return new BoundaryMarkingResult(true, 0, startNode, ontology);
    }

    @Override
    public String toString() {
        return disconnected
                ? "Disconnected(" + startNode + ", " + ontology + ")"
                : "Marked(" + markedCount + ")";
    }
}
