package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.Product;
import my.custodyreconciler.app.repository.ProductRepository;
import my.custodyreconciler.app.service.util.AssetClassResolver;
import my.custodyreconciler.app.service.util.ISINUtil;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
public class ProductCatalogService implements ProductCatalog {
	private static final String EQUITY_LINKED = "equity_linked";

	private static final Map<String, String> PRODUCT_TYPES = Map.of(
			"phoenix", "Phoenix Autocallable",
			"orion", "Orion Autocallable",
			"himalaya", "Himalaya Autocallable",
			"participation_note", "Participation Note",
			"shark_note", "Shark Note",
			"reverse_convertible", "Reverse Convertible",
			"reverse_convertible_bond", "Reverse Convertible Bond"
	);

	private static final Map<String, TemplateProtection> TEMPLATE_PROTECTION = Map.of(
			"phoenix", new TemplateProtection(AssetClassResolver.PROTECTION_CONDITIONAL, false, false, true),
			"orion", new TemplateProtection(AssetClassResolver.PROTECTION_GUARANTEED_100, true, false, false),
			"himalaya", new TemplateProtection(AssetClassResolver.PROTECTION_GUARANTEED_100, true, false, false)
	);

	private final ProductRepository productRepository;

	public ProductCatalogService(ProductRepository productRepository) {
		this.productRepository = productRepository;
	}

	@Override
	public Optional<ProductClassification> lookupByIsin(String isin) {
		String normalized = ISINUtil.normalize(isin);
		if (normalized == null) {
			return Optional.empty();
		}
		return productRepository.findFirstByIsinIgnoreCase(normalized).map(this::classify);
	}

	ProductClassification classify(Product product) {
		String template = product.getTemplateId() == null ? null : product.getTemplateId().toLowerCase(Locale.ROOT);
		String productType = template == null ? null : PRODUCT_TYPES.getOrDefault(template, product.getTemplateId());
		String assetClass = product.getAssetClass() == null || product.getAssetClass().isBlank()
				? AssetClassResolver.STRUCTURED_PRODUCT
				: product.getAssetClass();
		TemplateProtection protection = template == null ? null : TEMPLATE_PROTECTION.get(template);
		if (protection != null) {
			return new ProductClassification(product.getProductId(), product.getIsin(), product.getTitle(),
					productType, assetClass, product.getIssuer(), EQUITY_LINKED, protection.protectionType(),
					protection.capitalGuaranteed100(), protection.capitalGuaranteedPartial(),
					protection.barrierProtected());
		}
		return new ProductClassification(product.getProductId(), product.getIsin(), product.getTitle(),
				productType, assetClass, product.getIssuer(), product.getUnderlyingType(),
				product.getProtectionType(),
				Boolean.TRUE.equals(product.getCapitalGuaranteed100()),
				Boolean.TRUE.equals(product.getCapitalGuaranteedPartial()),
				Boolean.TRUE.equals(product.getBarrierProtected()));
	}

	private record TemplateProtection(String protectionType,
									  boolean capitalGuaranteed100,
									  boolean capitalGuaranteedPartial,
									  boolean barrierProtected) {
	}
}
