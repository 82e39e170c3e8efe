package dev.asclepius.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Enables Spring Retry proxies for {@code @Retryable} store and embedding-service access.
 *
 * <p>Backoff settings come from {@code asclepius.store.retry.*} and {@code
 * asclepius.multimodal.retry.*}.
 */
@Configuration
@EnableRetry
public class RetryConfig {}
