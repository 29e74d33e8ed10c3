package org.bugfinder.filesystem;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 图案搜索 MCP 服务的 Bean 装配。
 * <p>
 * 把配置 {@link PatternFinderProperties} 注入到安全路径解析器与文本读取器中；搜索会话本身不是 Bean，每次调用新建。
 */
@Configuration(proxyBeanMethods = false)
public class PatternFinderConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(PatternFinderProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public TextFileLoader textFileLoader(PatternFinderProperties properties) {
        return new TextFileLoader(properties);
    }
}
