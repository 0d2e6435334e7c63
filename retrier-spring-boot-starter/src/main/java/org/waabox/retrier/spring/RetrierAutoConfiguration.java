package org.waabox.retrier.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.waabox.retrier.Retrier;
import org.waabox.retrier.RetryConfig;
import org.waabox.retrier.RetryListener;
import org.waabox.retrier.cancel.RetryTimer;
import org.waabox.retrier.metrics.RetryMetrics;

/**
 * Spring Boot auto-configuration for the retrier.
 *
 * <p>This configuration creates a {@link RetryConfig} from
 * {@link RetrierProperties}, wiring optional beans for the retry listener,
 * metrics and timer, and a shared {@link Retrier} on top of it. Both beans
 * back off when the application defines its own.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(RetrierProperties.class)
public class RetrierAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RetrierAutoConfiguration.class);

  /**
   * Creates the {@link RetryConfig} bean.
   *
   * @param properties       the configuration properties, never null
   * @param listenerProvider provider for an optional RetryListener bean
   * @param metricsProvider  provider for an optional RetryMetrics bean
   * @param timerProvider    provider for an optional RetryTimer bean
   *
   * @return the retry configuration, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public RetryConfig retryConfig(
      final RetrierProperties properties,
      final ObjectProvider<RetryListener> listenerProvider,
      final ObjectProvider<RetryMetrics> metricsProvider,
      final ObjectProvider<RetryTimer> timerProvider) {

    requireAtMostOne(listenerProvider, RetryListener.class);
    requireAtMostOne(metricsProvider, RetryMetrics.class);
    requireAtMostOne(timerProvider, RetryTimer.class);

    final RetryConfig.Builder builder = RetryConfig.builder()
        .attempts(properties.getAttempts())
        .delay(properties.getDelay())
        .maxDelay(properties.getMaxDelay())
        .maxJitter(properties.getMaxJitter())
        .delayStrategy(properties.getDelayType().strategy())
        .lastErrorOnly(properties.isLastErrorOnly())
        .wrapCancellationWithLastError(
            properties.isWrapCancellationWithLastError());

    listenerProvider.ifAvailable(listener -> {
      builder.onRetry(listener);
      log.info("Retrier using custom RetryListener: {}",
          listener.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Retrier using custom RetryMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    timerProvider.ifAvailable(timer -> {
      builder.timer(timer);
      log.info("Retrier using custom RetryTimer: {}",
          timer.getClass().getSimpleName());
    });

    log.info("Retrier configured with {} attempt(s), delay {} and {} "
        + "delay type", properties.getAttempts(), properties.getDelay(),
        properties.getDelayType());

    return builder.build();
  }

  /**
   * Creates the shared {@link Retrier} bean.
   *
   * @param config the retry configuration, never null
   *
   * @return the retrier, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public Retrier retrier(final RetryConfig config) {
    return Retrier.of(config);
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Retrier requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
