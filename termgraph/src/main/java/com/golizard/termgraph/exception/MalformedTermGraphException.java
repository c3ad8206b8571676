package com.golizard.termgraph.exception;

/**
 * 输入术语图不合法：根节点缺失、节点缺少层值、层值非单调导致裁剪无法收敛等
 */
public class MalformedTermGraphException extends RuntimeException {

    public MalformedTermGraphException(String message) {
        super(message);
    }
}
