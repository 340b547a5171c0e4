package com.github.spud.sample.ai.agentic.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 模型回退链配置 backends 的顺序即回退顺序
 */
@Data
@ConfigurationProperties(prefix = "app.model.router")
public class ModelRouterProperties {

  private int maxAttemptsPerBackend = 3;

  private Duration retryBackoff = Duration.ofMillis(500);

  private List<Backend> backends = new ArrayList<>();

  @Data
  public static class Backend {

    private String name;

    /**
     * openai | ollama
     */
    private String provider = "openai";

    private String model;

    private Duration timeout = Duration.ofSeconds(60);

    private boolean enabled = true;
  }
}
