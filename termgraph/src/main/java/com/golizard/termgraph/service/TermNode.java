package com.golizard.termgraph.service;

import com.golizard.termgraph.exception.MalformedTermGraphException;
import lombok.Getter;
import lombok.Setter;

import java.util.HashMap;
import java.util.Map;

/**
 * 术语图节点
 *
 * 层值按类别根节点分别记录（由分层器写入），注释由注释映射和边界标记阶段修改
 */
@Getter
@Setter
public class TermNode {
    private String termId;
    private String name;
    private String namespace;

    /** term / temporary_node */
    private String type;

    private TermAnnotation annotation = TermAnnotation.none();

    /** 类别根节点 -> 距根距离 */
    @Setter(lombok.AccessLevel.NONE)
    @Getter(lombok.AccessLevel.NONE)
    private Map<String, Integer> layers = new HashMap<>();

    public TermNode() {
    }

    public TermNode(String termId) {
        this.termId = termId;
    }

    public TermNode(String termId, String name) {
        this.termId = termId;
        this.name = name;
    }

    public boolean hasLayer(String ontology) {
        return layers.containsKey(ontology);
    }

    /**
     * 获取层值，不存在时返回 null
     */
    public Integer getLayer(String ontology) {
        return layers.get(ontology);
    }

    /**
     * 获取层值，不存在视为输入不合法
     */
    public int requireLayer(String ontology) {
        Integer layer = layers.get(ontology);
        if (layer == null) {
            throw new MalformedTermGraphException(
                    "Node " + termId + " has no layer for ontology " + ontology);
        }
        return layer;
    }

    public void setLayer(String ontology, int layer) {
        if (layer < 0) {
            throw new IllegalArgumentException("layer must be non-negative: " + layer);
        }
        layers.put(ontology, layer);
    }

    public void removeLayer(String ontology) {
        layers.remove(ontology);
    }

    public boolean isAnnotated() {
        return annotation.isPresent();
    }

    public boolean hasRealAnnotation() {
        return annotation.isReal();
    }

    public void addAnnotationIdentifier(String identifier) {
        this.annotation = annotation.withIdentifier(identifier);
    }

    public void setAnnotation(TermAnnotation annotation) {
        this.annotation = annotation != null ? annotation : TermAnnotation.none();
    }

    /**
     * 深拷贝（注释本身不可变，可共享）
     */
    public TermNode copy() {
        TermNode copy = new TermNode(termId, name);
        copy.namespace = namespace;
        copy.type = type;
        copy.annotation = annotation;
        copy.layers = new HashMap<>(layers);
        return copy;
    }

    @Override
    public String toString() {
        return termId;
    }
}
