package org.waabox.puckline.spring;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.waabox.puckline.DatasetKind;
import org.waabox.puckline.Puckline;
import org.waabox.puckline.PucklineConfig;
import org.waabox.puckline.RetryPolicy;
import org.waabox.puckline.metrics.CacheMetrics;
import org.waabox.puckline.query.BroadcastNamePolicy;
import org.waabox.puckline.upstream.NhlApiClient;
import org.waabox.puckline.upstream.NhlApiConfig;
import org.waabox.puckline.upstream.UpstreamClient;

/**
 * Spring Boot auto-configuration for Puckline.
 *
 * <p>Creates one {@link Puckline} per application context from the
 * {@link PucklineProperties}, backed by an {@link NhlApiClient} unless the
 * context defines its own {@link UpstreamClient}. Optional
 * {@link CacheMetrics}, {@link RetryPolicy} and {@link Clock} beans replace
 * the defaults; a {@link RetryPolicy} bean wins over the
 * {@code puckline.retry.*} properties.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(PucklineProperties.class)
public class PucklineAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PucklineAutoConfiguration.class);

  /**
   * Creates the NHL API client.
   *
   * @param properties the configuration properties, never null
   *
   * @return the client, never null
   */
  @Bean
  @ConditionalOnMissingBean(UpstreamClient.class)
  public UpstreamClient pucklineUpstreamClient(
      final PucklineProperties properties) {
    final PucklineProperties.Api api = properties.getApi();
    log.info("Puckline reading from {} with a {} timeout", api.getBaseUrl(),
        api.getTimeout());
    return new NhlApiClient(NhlApiConfig.builder()
        .baseUrl(api.getBaseUrl())
        .timeout(api.getTimeout())
        .connectTimeout(api.getConnectTimeout())
        .userAgent(api.getUserAgent())
        .build());
  }

  /**
   * Creates the singleton {@link Puckline} bean.
   *
   * @param properties          the configuration properties, never null
   * @param upstreamClient      the upstream client, never null
   * @param metricsProvider     provider for an optional CacheMetrics bean
   * @param retryPolicyProvider provider for an optional RetryPolicy bean
   * @param clockProvider       provider for an optional Clock bean
   *
   * @return the configured Puckline instance, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public Puckline puckline(
      final PucklineProperties properties,
      final UpstreamClient upstreamClient,
      final ObjectProvider<CacheMetrics> metricsProvider,
      final ObjectProvider<RetryPolicy> retryPolicyProvider,
      final ObjectProvider<Clock> clockProvider) {

    requireAtMostOne(metricsProvider, CacheMetrics.class);

    final Puckline.Builder builder = Puckline.builder()
        .config(config(properties))
        .upstreamClient(upstreamClient);

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Puckline using custom CacheMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final RetryPolicy retryPolicy = retryPolicyProvider.getIfAvailable(() ->
        RetryPolicy.of(properties.getRetry().getMaxAttempts(),
            properties.getRetry().getBackoff()));
    builder.retryPolicy(retryPolicy);

    clockProvider.ifAvailable(builder::clock);

    final Puckline puckline = builder.build();
    log.info("Puckline created for team {} in the {} division, {} load"
        + " attempt(s) on cold start", puckline.config().defaultTeam(),
        puckline.config().defaultDivision(), retryPolicy.maxAttempts());
    return puckline;
  }

  /**
   * Maps the properties to the core configuration.
   *
   * @param properties the properties, never null
   *
   * @return the configuration, never null
   */
  static PucklineConfig config(final PucklineProperties properties) {
    final PucklineProperties.Limits limits = properties.getLimits();
    return PucklineConfig.builder()
        .defaultTeam(properties.getTeam())
        .defaultDivision(properties.getDivision())
        .ttl(DatasetKind.RECENT, properties.getTtl().getRecent())
        .ttl(DatasetKind.UPCOMING, properties.getTtl().getUpcoming())
        .ttl(DatasetKind.STANDINGS, properties.getTtl().getStandings())
        .ttl(DatasetKind.TV_SCHEDULE, properties.getTtl().getTvSchedule())
        .zone(ZoneId.of(properties.getZone()))
        .upcoming(limits.getUpcoming().getDefault(),
            limits.getUpcoming().getMax())
        .recent(limits.getRecent().getDefault(), limits.getRecent().getMax())
        .broadcastNamePolicy(policy(properties.getNetworks()))
        .build();
  }

  private static BroadcastNamePolicy policy(
      final PucklineProperties.Networks networks) {
    if (networks == null) {
      return BroadcastNamePolicy.defaults();
    }
    return new BroadcastNamePolicy(networks.getPreferred(),
        networks.getPatterns(), networks.getNames());
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
          "Puckline requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
