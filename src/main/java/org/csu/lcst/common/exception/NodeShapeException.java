package org.csu.lcst.common.exception;

/**
 * @author hidyouth
 * @description: 特化节点无法接受给定的子节点序列时抛出
 *
 * 树构建器不会捕获该异常，也不会退回到通用 Node，它直接中止本次解析。
 */
public class NodeShapeException extends RuntimeException {
    public NodeShapeException(String message) {
        super(message);
    }
}
