package dev.loom.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@link RetrievalToolService} methods with Spring AI's MCP server
 * auto-configuration, which exposes each {@code @Tool} method over the configured transport.
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider loomTools(RetrievalToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
