package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.AccountProfile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountProfileRepository extends JpaRepository<AccountProfile, Long> {
}
