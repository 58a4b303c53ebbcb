package org.devios.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * Spring AI MCP Server 会从容器中收集 {@link ToolCallback}，把终端会话的操作暴露给展示层。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> shellToolCallbacks(ShellMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
