package org.bugfinder.search;

/**
 * 调用顺序错误：必须先加载图案，再扫描文本，最后拼装匹配。
 * <p>
 * 这是使用方式上的错误，不是数据错误。
 */
public class PatternNotSetException extends PatternSearchException {

    public PatternNotSetException(String message) {
        super(message);
    }
}
