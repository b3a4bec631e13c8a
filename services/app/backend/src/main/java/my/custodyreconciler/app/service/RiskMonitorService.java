package my.custodyreconciler.app.service;

import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.domain.AccountProfile;
import my.custodyreconciler.app.domain.AlertEventType;
import my.custodyreconciler.app.domain.AppUser;
import my.custodyreconciler.app.domain.BankAccount;
import my.custodyreconciler.app.domain.Holding;
import my.custodyreconciler.app.domain.PortfolioSnapshot;
import my.custodyreconciler.app.domain.UserRole;
import my.custodyreconciler.app.model.AllocationBreach;
import my.custodyreconciler.app.model.AllocationCategory;
import my.custodyreconciler.app.model.CategoryAllocation;
import my.custodyreconciler.app.repository.AccountProfileRepository;
import my.custodyreconciler.app.repository.AppUserRepository;
import my.custodyreconciler.app.service.util.AllocationCategoryUtil;
import my.custodyreconciler.app.service.util.AssetClassResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Evaluates the cash and allocation rules of one portfolio after its snapshot has been rebuilt.
 */
@Service
public class RiskMonitorService {
	private static final Logger logger = LoggerFactory.getLogger(RiskMonitorService.class);
	static final String DEFAULT_CASH_CURRENCY = "EUR";
	private static final List<UserRole> ADMIN_ROLES = List.of(UserRole.SUPERADMIN, UserRole.ADMIN);

	private final NotificationSink notificationSink;
	private final AppUserRepository appUserRepository;
	private final AccountProfileRepository accountProfileRepository;
	private final Duration overdraftDedupWindow;
	private final Duration breachDedupWindow;

	public RiskMonitorService(NotificationSink notificationSink,
							  AppUserRepository appUserRepository,
							  AccountProfileRepository accountProfileRepository,
							  AppProperties properties) {
		this.notificationSink = notificationSink;
		this.appUserRepository = appUserRepository;
		this.accountProfileRepository = accountProfileRepository;
		this.overdraftDedupWindow = properties.risk().overdraftDedupWindow();
		this.breachDedupWindow = properties.risk().breachDedupWindow();
	}

	public enum OverdraftOutcome {
		ALERTED,
		SUPPRESSED,
		RESOLVED
	}

	public record RiskEvaluation(OverdraftOutcome overdraft, List<AllocationBreach> breaches) {
	}

	public record PortfolioScope(BankAccount account, String bankId, String portfolioCode, String triggeredBy) {
		AlertMatchKey matchKey() {
			return new AlertMatchKey(account.getBankAccountId(), portfolioCode);
		}
	}

	public RiskEvaluation evaluate(PortfolioScope scope, List<Holding> holdings, PortfolioSnapshot snapshot) {
		OverdraftOutcome overdraft = checkOverdraft(scope, holdings);
		List<AllocationBreach> breaches = checkAllocationLimits(scope, snapshot);
		return new RiskEvaluation(overdraft, breaches);
	}

	/**
	 * Cash lines netted per currency; lines without a currency count as EUR.
	 */
	public static Map<String, BigDecimal> netCashByCurrency(List<Holding> holdings) {
		Map<String, BigDecimal> net = new TreeMap<>();
		for (Holding holding : holdings) {
			if (!AssetClassResolver.isCash(holding)) {
				continue;
			}
			String currency = holding.getCurrency() == null || holding.getCurrency().isBlank()
					? DEFAULT_CASH_CURRENCY
					: holding.getCurrency();
			BigDecimal value = holding.getMarketValue() == null ? BigDecimal.ZERO : holding.getMarketValue();
			net.merge(currency, value, BigDecimal::add);
		}
		return net;
	}

	public OverdraftOutcome checkOverdraft(PortfolioScope scope, List<Holding> holdings) {
		BankAccount account = scope.account();
		Map<String, BigDecimal> negative = netCashByCurrency(holdings).entrySet().stream()
				.filter(entry -> entry.getValue().signum() < 0)
				.collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, TreeMap::new));
		BigDecimal shortfall = negative.values().stream().map(BigDecimal::abs).reduce(BigDecimal.ZERO, BigDecimal::add);
		BigDecimal authorized = account.getAuthorizedOverdraft() == null ? BigDecimal.ZERO : account.getAuthorizedOverdraft();
		BigDecimal excess = shortfall.subtract(authorized);

		if (negative.isEmpty() || excess.signum() <= 0) {
			if (!negative.isEmpty()) {
				logger.info("Account {} portfolio {} is overdrawn by {} within its credit line of {}",
						account.getAccountNumber(), scope.portfolioCode(), shortfall, authorized);
			}
			notificationSink.resolveAlerts(AlertEventType.UNAUTHORIZED_OVERDRAFT, scope.matchKey());
			return OverdraftOutcome.RESOLVED;
		}
		if (notificationSink.hasRecentAlert(AlertEventType.UNAUTHORIZED_OVERDRAFT, scope.matchKey(), overdraftDedupWindow)) {
			logger.info("Skipping duplicate overdraft alert for account {} portfolio {}", account.getAccountNumber(),
					scope.portfolioCode());
			return OverdraftOutcome.SUPPRESSED;
		}

		Optional<AppUser> client = findUser(account.getOwnerId());
		Set<Long> recipients = new LinkedHashSet<>();
		appUserRepository.findByRoleInAndActiveTrue(ADMIN_ROLES).forEach(admin -> recipients.add(admin.getUserId()));
		client.map(AppUser::getRelationshipManagerId).ifPresent(recipients::add);
		if (recipients.isEmpty()) {
			logger.warn("Overdraft on account {} portfolio {} has no recipients", account.getAccountNumber(),
					scope.portfolioCode());
			return OverdraftOutcome.SUPPRESSED;
		}

		String clientName = clientName(client);
		String details = negative.entrySet().stream()
				.map(entry -> entry.getKey() + ": " + entry.getValue().toPlainString())
				.collect(Collectors.joining(", "));
		String creditLine = authorized.signum() > 0
				? " (exceeds credit line of " + referenceCurrency(account) + " " + authorized.toPlainString() + " by "
				+ excess.toPlainString() + ")"
				: "";
		Map<String, Object> metadata = baseMetadata(scope, client, clientName);
		List<Map<String, Object>> positions = new ArrayList<>();
		negative.forEach((currency, amount) ->
				positions.add(Map.<String, Object>of("currency", currency, "amount", amount)));
		metadata.put("negativeCashPositions", positions);
		metadata.put("shortfall", shortfall);
		metadata.put("authorizedOverdraft", authorized);
		metadata.put("excessOverdraft", excess);

		notificationSink.createAlert(new AlertRequest(
				AlertEventType.UNAUTHORIZED_OVERDRAFT,
				scope.matchKey(),
				scope.bankId(),
				List.copyOf(recipients),
				"Negative Cash Balance Alert",
				"CRITICAL: " + clientName + "'s account " + scope.bankId() + " " + account.getAccountNumber()
						+ " has negative cash: " + details + creditLine,
				metadata,
				scope.triggeredBy()
		));
		return OverdraftOutcome.ALERTED;
	}

	public List<AllocationBreach> checkAllocationLimits(PortfolioScope scope, PortfolioSnapshot snapshot) {
		BankAccount account = scope.account();
		Optional<AccountProfile> profile = accountProfileRepository.findById(account.getBankAccountId());
		if (profile.isEmpty() || snapshot == null || snapshot.getTotalAccountValue() == null
				|| snapshot.getTotalAccountValue().signum() == 0) {
			return List.of();
		}
		CategoryAllocation allocation = AllocationCategoryUtil.aggregate(snapshot.getAssetClassBreakdown(),
				snapshot.getTotalAccountValue());
		List<AllocationBreach> breaches = new ArrayList<>();
		for (AllocationCategory category : AllocationCategory.values()) {
			BigDecimal limit = limitFor(profile.get(), category);
			BigDecimal current = allocation.percentOf(category);
			if (limit != null && current.compareTo(limit) > 0) {
				breaches.add(new AllocationBreach(category, current, limit));
			}
		}
		if (breaches.isEmpty()) {
			return breaches;
		}
		logger.info("Account {} portfolio {} has {} allocation breaches", account.getAccountNumber(),
				scope.portfolioCode(), breaches.size());
		if (notificationSink.hasRecentAlert(AlertEventType.ALLOCATION_BREACH, scope.matchKey(), breachDedupWindow)) {
			logger.info("Skipping duplicate breach alert for account {} portfolio {}", account.getAccountNumber(),
					scope.portfolioCode());
			return breaches;
		}

		Optional<AppUser> client = findUser(account.getOwnerId());
		String clientName = clientName(client);
		String details = breaches.stream().map(AllocationBreach::describe).collect(Collectors.joining(", "));
		Map<String, Object> metadata = baseMetadata(scope, client, clientName);
		metadata.put("breaches", breaches.stream().map(breach -> Map.<String, Object>of(
				"category", breach.category().label(),
				"current", breach.currentPercent(),
				"limit", breach.limitPercent())).toList());
		metadata.put("allocation", Map.of(
				"cash", allocation.cash(),
				"bonds", allocation.bonds(),
				"equities", allocation.equities(),
				"alternative", allocation.alternative()));
		String message = clientName + "'s account " + scope.bankId() + " " + account.getAccountNumber()
				+ " exceeds investment profile limits.\n\n" + details;

		List<Long> triggering = triggeringRecipients(scope.triggeredBy());
		for (Long recipient : triggering) {
			raiseBreach(scope, recipient, message, metadata);
		}
		Long relationshipManager = client.map(AppUser::getRelationshipManagerId).orElse(null);
		if (relationshipManager != null && !triggering.contains(relationshipManager)) {
			raiseBreach(scope, relationshipManager, message, metadata);
		}
		return breaches;
	}

	private void raiseBreach(PortfolioScope scope, Long recipient, String message, Map<String, Object> metadata) {
		notificationSink.createAlert(new AlertRequest(
				AlertEventType.ALLOCATION_BREACH,
				scope.matchKey(),
				scope.bankId(),
				List.of(recipient),
				"Allocation Limit Breached",
				message,
				metadata,
				scope.triggeredBy()
		));
	}

	/**
	 * The operator who ran the import, or every admin when the run has no operator known to the user store.
	 */
	private List<Long> triggeringRecipients(String triggeredBy) {
		Optional<AppUser> operator = triggeredBy == null
				? Optional.empty()
				: appUserRepository.findByUsername(triggeredBy).filter(AppUser::isActive);
		if (operator.isPresent()) {
			return List.of(operator.get().getUserId());
		}
		return appUserRepository.findByRoleInAndActiveTrue(ADMIN_ROLES).stream().map(AppUser::getUserId).toList();
	}

	private BigDecimal limitFor(AccountProfile profile, AllocationCategory category) {
		return switch (category) {
			case CASH -> profile.getMaxCash();
			case BONDS -> profile.getMaxBonds();
			case EQUITIES -> profile.getMaxEquities();
			case ALTERNATIVE -> profile.getMaxAlternative();
		};
	}

	private Map<String, Object> baseMetadata(PortfolioScope scope, Optional<AppUser> client, String clientName) {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("bankAccountId", scope.account().getBankAccountId());
		metadata.put("portfolioCode", scope.portfolioCode());
		metadata.put("clientId", scope.account().getOwnerId());
		metadata.put("clientName", clientName);
		client.map(AppUser::getRelationshipManagerId).ifPresent(id -> metadata.put("relationshipManagerId", id));
		return metadata;
	}

	private Optional<AppUser> findUser(Long userId) {
		return userId == null ? Optional.empty() : appUserRepository.findById(userId);
	}

	private String clientName(Optional<AppUser> client) {
		return client.map(user -> user.getDisplayName() != null && !user.getDisplayName().isBlank()
						? user.getDisplayName()
						: user.getUsername())
				.orElse("Unknown");
	}

	private String referenceCurrency(BankAccount account) {
		return account.getReferenceCurrency() == null ? DEFAULT_CASH_CURRENCY : account.getReferenceCurrency();
	}
}
