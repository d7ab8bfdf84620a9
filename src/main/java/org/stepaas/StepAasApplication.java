package org.stepaas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * STEP 装配构建 MCP Server 入口（stdio 传输）。
 * <p>
 * stdout 专用于 MCP 协议帧，所有日志都走 stderr 或滚动文件。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class StepAasApplication {

    static final String LOG_PATH = "LOG_PATH";

    public static void main(String[] args) {
        prepareLogDirectory(resolveLogDirectory());
        SpringApplication.run(StepAasApplication.class, args);
    }

    /**
     * 与 logback-spring.xml 的取值顺序一致：系统属性，其次环境变量，默认 ./logs。
     */
    static Path resolveLogDirectory() {
        String value = System.getProperty(LOG_PATH);
        if (value == null || value.isBlank()) {
            value = System.getenv(LOG_PATH);
        }
        return Path.of((value == null || value.isBlank()) ? "logs" : value);
    }

    // RollingFileAppender 不会自己建目录；建不出来时只提示，文件日志失效但服务照常启动
    private static void prepareLogDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            System.err.println("无法创建日志目录 " + directory.toAbsolutePath() + "：" + e.getMessage());
        }
    }
}
