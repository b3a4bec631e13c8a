package my.custodyreconciler.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import javax.sql.DataSource;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Waits for PostgreSQL, runs the Liquibase changelog and only then lets JPA start.
 */
@Configuration
@EnableConfigurationProperties(DatabaseConfig.DatabaseSettings.class)
public class DatabaseConfig {
	static final String DEFAULT_CHANGELOG = "classpath:db/changelog/db.changelog-master.yaml";

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource, DatabaseSettings settings) {
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(settings.startupTimeoutSeconds());
		validator.setInterval(settings.startupIntervalSeconds());
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, DatabaseSettings settings) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		liquibase.setChangeLog(settings.changeLog());
		liquibase.setShouldRun(settings.migrateOnStartup());
		return liquibase;
	}

	@Bean
	public static BeanFactoryPostProcessor liquibaseDependsOnPostProcessor() {
		return beanFactory -> {
			addDependsOn(beanFactory, "entityManagerFactory", "liquibase");
			addDependsOn(beanFactory, "jpaSharedEM_entityManagerFactory", "liquibase");
		};
	}

	private static void addDependsOn(ConfigurableListableBeanFactory beanFactory, String beanName, String dependency) {
		if (!beanFactory.containsBeanDefinition(beanName)) {
			return;
		}
		BeanDefinition definition = beanFactory.getBeanDefinition(beanName);
		Set<String> merged = new LinkedHashSet<>();
		if (definition.getDependsOn() != null) {
			merged.addAll(Arrays.asList(definition.getDependsOn()));
		}
		merged.add(dependency);
		definition.setDependsOn(merged.toArray(new String[0]));
	}

	@ConfigurationProperties(prefix = "app.database")
	public record DatabaseSettings(
			String changeLog,
			Boolean migrateOnStartup,
			Integer startupTimeoutSeconds,
			Integer startupIntervalSeconds
	) {
		public DatabaseSettings {
			changeLog = changeLog == null || changeLog.isBlank() ? DEFAULT_CHANGELOG : changeLog;
			migrateOnStartup = migrateOnStartup == null || migrateOnStartup;
			startupTimeoutSeconds = startupTimeoutSeconds == null ? 60 : startupTimeoutSeconds;
			startupIntervalSeconds = startupIntervalSeconds == null ? 5 : startupIntervalSeconds;
		}
	}
}
