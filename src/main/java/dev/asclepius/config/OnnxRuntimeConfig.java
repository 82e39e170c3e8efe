package dev.asclepius.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Configures the ONNX Runtime environment used by the in-process BGE text embedding model before
 * any model bean is created.
 *
 * <p>The {@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured after the
 * first {@code getEnvironment()} call, which the embedding model's static initializer makes.
 * Running as a {@link BeanFactoryPostProcessor} guarantees the threading options below are applied
 * first.
 *
 * <p>Thread counts come from {@code asclepius.onnx.intra-op-threads} (default 4) and {@code
 * asclepius.onnx.inter-op-threads} (default 2); spinning is always disabled. Property binding is
 * not available this early, so values are read from the {@link Environment} directly.
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 4;
  private int interOpThreads = 2;

  @Override
  public void setEnvironment(Environment environment) {
    intraOpThreads =
        environment.getProperty("asclepius.onnx.intra-op-threads", Integer.class, 4);
    interOpThreads =
        environment.getProperty("asclepius.onnx.inter-op-threads", Integer.class, 2);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "asclepius", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
