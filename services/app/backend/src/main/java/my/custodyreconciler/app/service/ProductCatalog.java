package my.custodyreconciler.app.service;

import java.util.Optional;

public interface ProductCatalog {
	Optional<ProductClassification> lookupByIsin(String isin);
}
