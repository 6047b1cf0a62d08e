package com.p0ntus.now_playing.health;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.p0ntus.now_playing.config.ProviderProperties;
import com.p0ntus.now_playing.connectors.ListenBrainzClient;
import com.p0ntus.now_playing.exception.ProviderTimeoutException;
import com.p0ntus.now_playing.exception.ProviderUnavailableException;

/**
 * Checks that the history provider answers. Without it no aggregation can complete;
 * the enrichment and artwork providers are optional and not checked.
 */
@Component
public class ListenBrainzHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(ListenBrainzHealthIndicator.class);

	private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(10);

	private final ListenBrainzClient listenBrainzClient;
	private final ProviderProperties providers;

	public ListenBrainzHealthIndicator(ListenBrainzClient listenBrainzClient, ProviderProperties providers) {
		this.listenBrainzClient = listenBrainzClient;
		this.providers = providers;
	}

	@Override
	public Health health() {
		String baseUrl = providers.listenbrainz().baseUrl();
		try {
			listenBrainzClient.getPlayingNow()
					.doOnSuccess(response -> logger.debug("ListenBrainz health check passed"))
					.block(HEALTH_CHECK_TIMEOUT);

			return Health.up()
					.withDetail("api", ListenBrainzClient.PROVIDER)
					.withDetail("baseUrl", baseUrl)
					.withDetail("user", listenBrainzClient.getUser())
					.withDetail("status", "reachable")
					.build();
		} catch (ProviderTimeoutException ex) {
			logger.warn("ListenBrainz health check failed: {}", ex.getMessage());
			return Health.down()
					.withDetail("api", ListenBrainzClient.PROVIDER)
					.withDetail("baseUrl", baseUrl)
					.withDetail("error", "Request timeout")
					.build();
		} catch (ProviderUnavailableException ex) {
			Integer statusCode = ex.getStatusCode();
			String error;
			if (statusCode != null && (statusCode == 401 || statusCode == 403)) {
				logger.error("ListenBrainz health check failed: Unauthorized ({}) - check token configuration",
						statusCode);
				error = "Unauthorized - invalid token";
			} else {
				logger.warn("ListenBrainz health check failed: {}", ex.getMessage());
				error = ex.getMessage();
			}
			Health.Builder builder = Health.down()
					.withDetail("api", ListenBrainzClient.PROVIDER)
					.withDetail("baseUrl", baseUrl)
					.withDetail("error", error);
			if (statusCode != null) {
				builder.withDetail("statusCode", statusCode);
			}
			return builder.build();
		} catch (Exception ex) {
			logger.error("ListenBrainz health check failed: Unexpected error", ex);
			return Health.down()
					.withDetail("api", ListenBrainzClient.PROVIDER)
					.withDetail("baseUrl", baseUrl)
					.withDetail("error", ex.getMessage() != null ? ex.getMessage() : "Unknown error")
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();
		}
	}
}
