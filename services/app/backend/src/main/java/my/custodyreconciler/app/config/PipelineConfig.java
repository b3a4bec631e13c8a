package my.custodyreconciler.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class PipelineConfig {
	@Bean(name = "reconciliationExecutor")
	public ThreadPoolTaskExecutor reconciliationExecutor(AppProperties properties) {
		ThreadPoolTaskExecutor taskExecutor = new ThreadPoolTaskExecutor();
		int poolSize = properties.pipeline().parallelism();
		taskExecutor.setCorePoolSize(poolSize);
		taskExecutor.setMaxPoolSize(poolSize);
		taskExecutor.setThreadNamePrefix("reconcile-");
		taskExecutor.setAllowCoreThreadTimeOut(true);
		taskExecutor.setWaitForTasksToCompleteOnShutdown(true);
		taskExecutor.setAwaitTerminationSeconds(30);
		taskExecutor.initialize();
		return taskExecutor;
	}
}
