package com.golizard.termgraph.model;

/**
 * 术语关系（边），方向由更具体的术语指向更一般的术语
 */
public class OntologyRelation {
    /**
     * 更具体的术语
     */
    private String source;

    /**
     * 更一般的术语
     */
    private String target;

    /**
     * 关系类型（is_a / part_of / connects ...）
     */
    private String relation;

    public OntologyRelation() {
    }

    public OntologyRelation(String source, String target, String relation) {
        this.source = source;
        this.target = target;
        this.relation = relation;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getRelation() {
        return relation;
    }

    public void setRelation(String relation) {
        this.relation = relation;
    }
}
