package my.custodyreconciler.app.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.importer.FeedUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Service
@ConditionalOnProperty(name = "app.feed.scheduler-enabled", havingValue = "true")
public class BankFeedImportScheduler {
	private static final Logger logger = LoggerFactory.getLogger(BankFeedImportScheduler.class);
	static final String SCHEDULER_ACTOR = "scheduler";
	private final PositionImportService importService;
	private final List<String> banks;
	private final long pollIntervalSeconds;
	private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();

	public BankFeedImportScheduler(PositionImportService importService, AppProperties properties) {
		this.importService = importService;
		this.banks = properties.feed().banks();
		this.pollIntervalSeconds = properties.feed().pollIntervalSeconds();
	}

	@PostConstruct
	public void schedule() {
		if (banks.isEmpty()) {
			logger.warn("Feed scheduler enabled but app.feed.banks is empty");
			return;
		}
		scheduleNext(5);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void scheduleNext(long delaySeconds) {
		executor.schedule(this::runOnce, Math.max(1, delaySeconds), TimeUnit.SECONDS);
	}

	void runOnce() {
		for (String bankId : banks) {
			try {
				importService.importNewFromFeed(bankId, SCHEDULER_ACTOR);
			} catch (FeedUnavailableException ex) {
				logger.info("No feed for bank {}: {}", bankId, ex.getMessage());
			} catch (Exception ex) {
				logger.warn("Scheduled import for bank {} failed: {}", bankId, ex.getMessage());
			}
		}
		scheduleNext(pollIntervalSeconds);
	}
}
