package my.custodyreconciler.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Security security,
		@Valid Jwt jwt,
		@Valid Reconciliation reconciliation,
		@Valid Allocation allocation,
		@Valid Risk risk,
		@Valid Pipeline pipeline,
		@Valid Feed feed
) {
	public AppProperties {
		reconciliation = reconciliation == null ? new Reconciliation(false) : reconciliation;
		allocation = allocation == null ? new Allocation(null) : allocation;
		risk = risk == null ? new Risk(null, null) : risk;
		pipeline = pipeline == null ? new Pipeline(null, null) : pipeline;
		feed = feed == null ? new Feed(null, null, false, null) : feed;
	}

	public record Security(
			@NotBlank String adminUser,
			@NotBlank String adminPass
	) {
	}

	public record Jwt(
			String secret,
			@NotBlank String issuer,
			Duration tokenTtl
	) {
		public Jwt {
			tokenTtl = tokenTtl == null ? Duration.ofHours(1) : tokenTtl;
		}
	}

	/**
	 * @param versionHistory insert a new holding version on change instead of updating in place
	 */
	public record Reconciliation(
			boolean versionHistory
	) {
	}

	public record Allocation(
			@Min(0) Integer redemptionGraceDays
	) {
		public Allocation {
			redemptionGraceDays = redemptionGraceDays == null ? 30 : redemptionGraceDays;
		}
	}

	/**
	 * A zero window disables deduplication for that alert type.
	 */
	public record Risk(
			Duration overdraftDedupWindow,
			Duration breachDedupWindow
	) {
		public Risk {
			overdraftDedupWindow = overdraftDedupWindow == null ? Duration.ofHours(24) : overdraftDedupWindow;
			breachDedupWindow = breachDedupWindow == null ? Duration.ZERO : breachDedupWindow;
		}
	}

	public record Pipeline(
			@Min(1) Integer parallelism,
			Duration batchTimeout
	) {
		public Pipeline {
			parallelism = parallelism == null ? 4 : parallelism;
			batchTimeout = batchTimeout == null ? Duration.ofMinutes(10) : batchTimeout;
		}
	}

	public record Feed(
			String root,
			List<String> banks,
			boolean schedulerEnabled,
			Integer pollIntervalSeconds
	) {
		public Feed {
			root = root == null || root.isBlank() ? "./data/feed" : root;
			banks = banks == null ? List.of() : List.copyOf(banks);
			pollIntervalSeconds = pollIntervalSeconds == null ? 900 : pollIntervalSeconds;
		}
	}
}
