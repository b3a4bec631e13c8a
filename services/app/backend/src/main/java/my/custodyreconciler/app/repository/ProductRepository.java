package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.Product;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {
	Optional<Product> findFirstByIsinIgnoreCase(String isin);
}
