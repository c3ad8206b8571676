package com.golizard.termgraph.exception;

/**
 * 术语图清理失败（终止性错误）
 *
 * 携带失败的类别根节点和清理尝试序号，由编排器在修复次数耗尽或类别任务失败时抛出
 */
public class GraphCleaningException extends RuntimeException {

    private final String category;
    private final int attempt;

    public GraphCleaningException(String category, int attempt, String message) {
        super(message);
        this.category = category;
        this.attempt = attempt;
    }

    public GraphCleaningException(String category, int attempt, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.attempt = attempt;
    }

    public String getCategory() {
        return category;
    }

    public int getAttempt() {
        return attempt;
    }
}
