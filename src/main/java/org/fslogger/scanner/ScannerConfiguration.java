package org.fslogger.scanner;

import org.fslogger.export.JsonBlockedFilesExporter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 扫描服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把配置 {@link ScannerProperties} 注入到路径解析器与扫描任务登记表中。</li>
 *   <li>导出器使用独立配置的 Jackson {@code ObjectMapper}（ISO-8601 时间格式），不依赖 Web 层的序列化配置。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class ScannerConfiguration {

    @Bean
    public ScanPathResolver scanPathResolver(ScannerProperties properties) {
        return new ScanPathResolver(properties);
    }

    @Bean
    public JsonBlockedFilesExporter blockedFilesExporter() {
        return new JsonBlockedFilesExporter();
    }

    @Bean(destroyMethod = "shutdown")
    public ScanRegistry scanRegistry(ScannerProperties properties, JsonBlockedFilesExporter exporter) {
        return new ScanRegistry(properties.getFinishedScanTtl(), properties.getMaxConcurrentScans(), exporter);
    }
}
