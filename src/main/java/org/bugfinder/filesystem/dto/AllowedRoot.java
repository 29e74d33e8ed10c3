package org.bugfinder.filesystem.dto;

/**
 * 允许读取的根目录。
 *
 * @param rootId 根目录标识（root0、root1...）
 * @param path   根目录绝对路径
 */
public record AllowedRoot(String rootId, String path) {
}
