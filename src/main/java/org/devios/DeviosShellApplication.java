package org.devios;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeviosShellApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(DeviosShellApplication.class, args);
    }

    /**
     * 提前创建日志目录（RollingFileAppender 在目录不存在时会初始化失败）。
     * <p>
     * 规则与 logback-spring.xml 一致：优先系统属性，其次环境变量 LOG_PATH，默认 ./logs
     */
    static Path ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        Path directory = Path.of(logPath);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            // stdout 是 MCP 传输通道，只能写 stderr
            System.err.println("无法创建日志目录 " + directory + "：" + e.getMessage());
        }
        return directory;
    }
}
