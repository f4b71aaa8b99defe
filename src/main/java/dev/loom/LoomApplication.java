package dev.loom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the Loom retrieval service.
 *
 * <p>Exposes the retrieval pipeline as MCP tools. The {@code stdio} profile switches the MCP
 * server to the stdio transport and disables the web server.
 */
@SpringBootApplication
@EnableRetry
public class LoomApplication {
    public static void main(String[] args) {
        SpringApplication.run(LoomApplication.class, args);
    }
}
