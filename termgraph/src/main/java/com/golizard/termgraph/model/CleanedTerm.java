package com.golizard.termgraph.model;

import java.util.List;

/**
 * 清理后的术语节点（返回给渲染端的节点结构）
 */
public class CleanedTerm {
    private String id;
    private String name;

    /**
     * 术语 / 连接节点（temporary_node）
     */
    private String type;

    /**
     * 距类别根节点的层值
     */
    private Integer layer;

    /**
     * UNANNOTATED / REAL / BOUNDARY / TRANSIT
     */
    private String annotationKind;

    /**
     * 命中该术语的外部标识符（仅真实注释）
     */
    private List<String> identifiers;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Integer getLayer() {
        return layer;
    }

    public void setLayer(Integer layer) {
        this.layer = layer;
    }

    public String getAnnotationKind() {
        return annotationKind;
    }

    public void setAnnotationKind(String annotationKind) {
        this.annotationKind = annotationKind;
    }

    public List<String> getIdentifiers() {
        return identifiers;
    }

    public void setIdentifiers(List<String> identifiers) {
        this.identifiers = identifiers;
    }
}
