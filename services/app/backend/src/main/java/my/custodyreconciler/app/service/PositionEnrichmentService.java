package my.custodyreconciler.app.service;

import my.custodyreconciler.app.importer.BankPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Overlays catalog knowledge on positions whose ISIN is a product of ours. Custodian names and classes for
 * structured products are unreliable, the catalog wins.
 */
@Service
public class PositionEnrichmentService {
	private static final Logger logger = LoggerFactory.getLogger(PositionEnrichmentService.class);
	static final String ENRICHED_AT = "enrichedAt";
	private final ProductCatalog productCatalog;

	public PositionEnrichmentService(ProductCatalog productCatalog) {
		this.productCatalog = productCatalog;
	}

	public BankPosition enrich(BankPosition position) {
		if (position.isin() == null || position.isin().isBlank()) {
			return position;
		}
		Optional<ProductClassification> match;
		try {
			match = productCatalog.lookupByIsin(position.isin());
		} catch (RuntimeException ex) {
			logger.warn("Catalog lookup failed for ISIN {}, keeping custodian data: {}", position.isin(), ex.getMessage());
			return position;
		}
		if (match.isEmpty()) {
			return position;
		}
		ProductClassification product = match.get();
		String name = product.title() == null || product.title().isBlank() ? position.securityName() : product.title();
		return position.withEnrichment(name, product.assetClass(), classificationData(product));
	}

	private Map<String, Object> classificationData(ProductClassification product) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("productId", product.productId());
		putIfPresent(data, "productType", product.productType());
		putIfPresent(data, "productTitle", product.title());
		putIfPresent(data, "issuer", product.issuer());
		putIfPresent(data, "underlyingType", product.underlyingType());
		putIfPresent(data, "protectionType", product.protectionType());
		data.put("capitalGuaranteed100", product.capitalGuaranteed100());
		data.put("capitalGuaranteedPartial", product.capitalGuaranteedPartial());
		data.put("barrierProtected", product.barrierProtected());
		data.put("autoEnriched", true);
		data.put(ENRICHED_AT, LocalDateTime.now().toString());
		return data;
	}

	private void putIfPresent(Map<String, Object> data, String key, String value) {
		if (value != null && !value.isBlank()) {
			data.put(key, value);
		}
	}
}
