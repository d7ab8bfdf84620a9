package org.stepaas.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 把 {@link AssemblyMcpTools} 中的 {@code @Tool} 方法注册为 {@link ToolCallback}，由 MCP Server 自动收集。
 */
@Configuration(proxyBeanMethods = false)
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> assemblyToolCallbacks(AssemblyMcpTools assemblyTools) {
        return List.of(ToolCallbacks.from(assemblyTools));
    }
}
