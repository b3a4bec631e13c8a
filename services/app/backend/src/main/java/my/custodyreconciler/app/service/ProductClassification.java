package my.custodyreconciler.app.service;

/**
 * What the internal catalog knows about a product, with the template defaults applied.
 */
public record ProductClassification(
		Long productId,
		String isin,
		String title,
		String productType,
		String assetClass,
		String issuer,
		String underlyingType,
		String protectionType,
		boolean capitalGuaranteed100,
		boolean capitalGuaranteedPartial,
		boolean barrierProtected
) {
}
