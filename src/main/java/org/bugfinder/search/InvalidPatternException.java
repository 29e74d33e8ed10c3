package org.bugfinder.search;

/**
 * 图案缺失、无法读取，或解析后没有任何片段。
 */
public class InvalidPatternException extends PatternSearchException {

    public InvalidPatternException(String message) {
        super(message);
    }

    public InvalidPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
