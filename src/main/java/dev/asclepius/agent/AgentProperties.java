package dev.asclepius.agent;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the agent tool loop.
 *
 * <p>Properties are bound from {@code asclepius.agent.*} in application.yml.
 *
 * <ul>
 *   <li>{@code max-iterations} - decision steps that may request tools before the loop stops with
 *       {@code ITERATION_LIMIT_EXCEEDED} (default 8, bounded [1, 50])
 *   <li>{@code tool-timeout} - timeout of a single tool call (default 20s)
 *   <li>{@code time-budget} - wall-clock budget of one question (default 120s)
 *   <li>{@code max-parallel-tools} - worker threads shared by concurrent tool calls (default 4)
 *   <li>{@code tool-result-token-budget} - estimated tokens of one tool result passed back to the
 *       model (default 2000)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "asclepius.agent")
public class AgentProperties {

  private int maxIterations = 8;
  private Duration toolTimeout = Duration.ofSeconds(20);
  private Duration timeBudget = Duration.ofSeconds(120);
  private int maxParallelTools = 4;
  private int toolResultTokenBudget = 2000;

  @PostConstruct
  void validate() {
    if (maxIterations < 1 || maxIterations > 50) {
      throw new IllegalStateException(
          "asclepius.agent.max-iterations must be in [1, 50], got: " + maxIterations);
    }
    if (toolTimeout == null || toolTimeout.isNegative() || toolTimeout.isZero()) {
      throw new IllegalStateException(
          "asclepius.agent.tool-timeout must be positive, got: " + toolTimeout);
    }
    if (timeBudget == null || timeBudget.compareTo(toolTimeout) < 0) {
      throw new IllegalStateException(
          "asclepius.agent.time-budget must be at least the tool timeout, got: " + timeBudget);
    }
    if (maxParallelTools < 1) {
      throw new IllegalStateException(
          "asclepius.agent.max-parallel-tools must be positive, got: " + maxParallelTools);
    }
    if (toolResultTokenBudget < 100) {
      throw new IllegalStateException(
          "asclepius.agent.tool-result-token-budget must be at least 100, got: "
              + toolResultTokenBudget);
    }
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public Duration getToolTimeout() {
    return toolTimeout;
  }

  public void setToolTimeout(Duration toolTimeout) {
    this.toolTimeout = toolTimeout;
  }

  public Duration getTimeBudget() {
    return timeBudget;
  }

  public void setTimeBudget(Duration timeBudget) {
    this.timeBudget = timeBudget;
  }

  public int getMaxParallelTools() {
    return maxParallelTools;
  }

  public void setMaxParallelTools(int maxParallelTools) {
    this.maxParallelTools = maxParallelTools;
  }

  public int getToolResultTokenBudget() {
    return toolResultTokenBudget;
  }

  public void setToolResultTokenBudget(int toolResultTokenBudget) {
    this.toolResultTokenBudget = toolResultTokenBudget;
  }
}
