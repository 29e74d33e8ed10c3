package org.bugfinder.search;

/**
 * 图案搜索相关异常的基类（非受检）。
 */
public class PatternSearchException extends RuntimeException {

    public PatternSearchException(String message) {
        super(message);
    }

    public PatternSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
