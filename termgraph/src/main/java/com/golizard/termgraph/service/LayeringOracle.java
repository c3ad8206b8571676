package com.golizard.termgraph.service;

/**
 * 分层器：为类别根节点计算每个可达节点的距根层值
 *
 * 实现必须把层值写入图中每个可达节点（{@link TermNode#setLayer}），
 * 并清除该类别在不可达节点上的旧层值。图拓扑变化（如断连修复）后需重新调用
 */
public interface LayeringOracle {

    /**
     * @param graph 术语图（会被写入层值）
     * @param root  类别根节点
     * @return 分层结果
     */
    CategoryLayering computeLayers(TermGraph graph, String root);
}
