package com.golizard.termgraph.model;

/**
 * 本体术语（请求中的节点结构）
 */
public class OntologyTerm {
    /**
     * 术语ID（如 GO:0008150）
     */
    private String id;

    private String name;

    /**
     * 所属命名空间（biological_process 等）
     */
    private String namespace;

    /**
     * 是否为必须保留的过渡节点
     */
    private boolean transit;

    public OntologyTerm() {
    }

    public OntologyTerm(String id, String name) {
        this.id = id;
        this.name = name;
    }

    // Getters and Setters

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

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public boolean isTransit() {
        return transit;
    }

    public void setTransit(boolean transit) {
        this.transit = transit;
    }
}
