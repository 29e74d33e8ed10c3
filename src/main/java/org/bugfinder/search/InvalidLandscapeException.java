package org.bugfinder.search;

/**
 * 被搜索的文本（landscape）缺失或无法读取。
 */
public class InvalidLandscapeException extends PatternSearchException {

    public InvalidLandscapeException(String message) {
        super(message);
    }

    public InvalidLandscapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
