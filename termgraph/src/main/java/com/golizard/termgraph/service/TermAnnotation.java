package com.golizard.termgraph.service;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 节点注释（不可变）
 *
 * 用显式的 {@link AnnotationKind} 区分真实注释与哨兵值，
 * 真实注释的标识符保持加入顺序且不重复
 */
@Getter
@EqualsAndHashCode
public final class TermAnnotation {

    private static final TermAnnotation NONE = new TermAnnotation(AnnotationKind.UNANNOTATED, Collections.emptySet());
    private static final TermAnnotation BOUNDARY = new TermAnnotation(AnnotationKind.BOUNDARY, Collections.emptySet());
    private static final TermAnnotation TRANSIT = new TermAnnotation(AnnotationKind.TRANSIT, Collections.emptySet());

    private final AnnotationKind kind;
    private final Set<String> identifiers;

    private TermAnnotation(AnnotationKind kind, Set<String> identifiers) {
        this.kind = kind;
        this.identifiers = identifiers;
    }

    public static TermAnnotation none() {
        return NONE;
    }

    public static TermAnnotation boundary() {
        return BOUNDARY;
    }

    public static TermAnnotation transit() {
        return TRANSIT;
    }

    /**
     * 追加一个标识符（幂等）
     *
     * 哨兵注释追加后变为只含该标识符的真实注释
     */
    public TermAnnotation withIdentifier(String identifier) {
        if (kind == AnnotationKind.REAL && identifiers.contains(identifier)) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>();
        if (kind == AnnotationKind.REAL) {
            merged.addAll(identifiers);
        }
        merged.add(identifier);
        return new TermAnnotation(AnnotationKind.REAL, Collections.unmodifiableSet(merged));
    }

    public boolean isReal() {
        return kind == AnnotationKind.REAL;
    }

    /**
     * 是否带有任何注释（真实注释或哨兵）
     */
    public boolean isPresent() {
        return kind != AnnotationKind.UNANNOTATED;
    }

    @Override
    public String toString() {
        return kind == AnnotationKind.REAL ? identifiers.toString() : kind.name();
    }
}
