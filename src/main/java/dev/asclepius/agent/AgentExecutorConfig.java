package dev.asclepius.agent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Bounded worker pool for tool calls requested together in one decision step.
 *
 * <p>Fixed size {@code asclepius.agent.max-parallel-tools}, with a bounded queue; a saturated pool
 * rejects the call, which the loop reports as an unavailable tool.
 */
@Configuration
public class AgentExecutorConfig {

  static final int QUEUE_CAPACITY_PER_THREAD = 16;

  @Bean(name = "agentToolExecutor", destroyMethod = "shutdownNow")
  public ExecutorService agentToolExecutor(AgentProperties properties) {
    int threads = properties.getMaxParallelTools();
    return new ThreadPoolExecutor(
        threads,
        threads,
        60L,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(threads * QUEUE_CAPACITY_PER_THREAD),
        new CustomizableThreadFactory("agent-tool-"),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
