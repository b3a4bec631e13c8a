package my.custodyreconciler.app.service.util;

import my.custodyreconciler.app.domain.Holding;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the snapshot breakdown key of a holding from its asset class, enrichment data and, when the
 * custodian left the class empty, from security type and name.
 */
public final class AssetClassResolver {
	public static final String CASH = "cash";
	public static final String STRUCTURED_PRODUCT = "structured_product";
	public static final String PROTECTION_GUARANTEED_100 = "capital_guaranteed_100";
	public static final String PROTECTION_GUARANTEED_PARTIAL = "capital_guaranteed_partial";
	public static final String PROTECTION_CONDITIONAL = "capital_protected_conditional";

	private static final List<String> STRUCTURED_ISSUERS = List.of("sg issuer", "julius baer express",
			"bnp paribas iss", "raiffeisen ch", "banque intern", "credit suisse ag", "credit agricole", "citigroup",
			"ubs ag", "vontobel");
	private static final List<String> STRUCTURED_NAMES = List.of("autocallable", "phoenix", "orion", "himalaya",
			"reverse convertible", "bar.cap", "barrier", "express", "cap.prot", "capital prot");

	private AssetClassResolver() {
	}

	public static boolean isCash(Holding holding) {
		return isCash(holding.getAssetClass(), holding.getSecurityType());
	}

	public static boolean isCash(String assetClass, String securityType) {
		if (assetClass != null && CASH.equalsIgnoreCase(assetClass.trim())) {
			return true;
		}
		return securityType != null && securityType.toUpperCase(Locale.ROOT).contains("CASH");
	}

	public static String categoryKey(Holding holding) {
		Map<String, Object> data = holding.getBankSpecificData() == null ? Map.of() : holding.getBankSpecificData();
		String assetClass = lower(holding.getAssetClass());
		String subClass = lower(text(data, "assetSubClass", "asset_sub_class"));
		String underlyingType = lower(text(data, "underlyingType", "underlying_type"));
		String protectionType = protectionType(data);

		if (assetClass == null || assetClass.equals("other")) {
			Heuristic guess = guess(lower(holding.getSecurityType()), lower(holding.getSecurityName()));
			assetClass = guess.assetClass();
			subClass = subClass == null ? guess.subClass() : subClass;
			protectionType = protectionType == null ? guess.protectionType() : protectionType;
		}

		if (assetClass.equals(STRUCTURED_PRODUCT)) {
			if (PROTECTION_GUARANTEED_100.equals(protectionType)) {
				return "structured_product_capital_guaranteed";
			}
			if (PROTECTION_GUARANTEED_PARTIAL.equals(protectionType)) {
				return "structured_product_partial_guarantee";
			}
			if (PROTECTION_CONDITIONAL.equals(protectionType)) {
				return "structured_product_barrier_protected";
			}
			return underlyingType == null ? STRUCTURED_PRODUCT : STRUCTURED_PRODUCT + "_" + underlyingType;
		}
		if ((assetClass.equals("equity") || assetClass.equals("fixed_income")) && subClass != null) {
			return subClass.startsWith(assetClass + "_") ? subClass : assetClass + "_" + subClass;
		}
		return assetClass;
	}

	private static String protectionType(Map<String, Object> data) {
		if (Boolean.TRUE.equals(flag(data, "capitalGuaranteed100"))) {
			return PROTECTION_GUARANTEED_100;
		}
		if (Boolean.TRUE.equals(flag(data, "capitalGuaranteedPartial"))) {
			return PROTECTION_GUARANTEED_PARTIAL;
		}
		if (Boolean.TRUE.equals(flag(data, "barrierProtected"))) {
			return PROTECTION_CONDITIONAL;
		}
		return lower(text(data, "protectionType", "protection_type"));
	}

	private static Heuristic guess(String type, String name) {
		String t = type == null ? "" : type;
		String n = name == null ? "" : name;
		boolean structuredByType = t.equals("certificate") || t.equals("structured");
		boolean structuredByIssuer = STRUCTURED_ISSUERS.stream().anyMatch(n::contains);
		boolean structuredByName = STRUCTURED_NAMES.stream().anyMatch(n::contains)
				|| (n.contains("cert") && !n.contains("certificate of deposit"));
		if (structuredByType || structuredByIssuer || structuredByName) {
			String protection = null;
			if (n.contains("capital guaranteed") || n.contains("cap.prot") || n.contains("capital protection")
					|| n.contains("100%")) {
				protection = PROTECTION_GUARANTEED_100;
			} else if (n.contains("bar.cap") || n.contains("barrier")) {
				protection = PROTECTION_CONDITIONAL;
			}
			return new Heuristic(STRUCTURED_PRODUCT, null, protection);
		}
		if (n.contains("private equity") || n.contains("kkr") || n.contains("blackstone")) {
			return new Heuristic("private_equity", null, null);
		}
		if (t.equals("money_market_fund") || (n.contains("money market") && n.contains("fund"))) {
			return new Heuristic("monetary_products", null, null);
		}
		if (t.equals("fund") || t.equals("etf") || n.contains("sicav") || n.contains("ucits")) {
			return new Heuristic("fund", null, null);
		}
		if (t.equals("equity") || t.equals("stock")) {
			return new Heuristic("equity", n.contains("fund") || n.contains("etf") ? "fund" : "direct", null);
		}
		if (t.equals("bond") || n.contains("treasury")) {
			return new Heuristic("fixed_income", n.contains("fund") ? "fund" : "direct", null);
		}
		if (t.equals("term_deposit") || n.contains("term deposit") || n.contains("time deposit")
				|| n.contains("fixed deposit")) {
			return new Heuristic("time_deposit", null, null);
		}
		if (n.contains("gold") || n.contains("commodity") || n.contains("metal")) {
			return new Heuristic("commodities", null, null);
		}
		return new Heuristic("other", null, null);
	}

	private static String text(Map<String, Object> data, String... keys) {
		for (String key : keys) {
			Object value = data.get(key);
			if (value != null && !value.toString().isBlank()) {
				return value.toString().trim();
			}
		}
		return null;
	}

	private static Boolean flag(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value instanceof Boolean bool) {
			return bool;
		}
		return value == null ? null : Boolean.valueOf(value.toString());
	}

	private static String lower(String value) {
		return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
	}

	private record Heuristic(String assetClass, String subClass, String protectionType) {
	}
}
