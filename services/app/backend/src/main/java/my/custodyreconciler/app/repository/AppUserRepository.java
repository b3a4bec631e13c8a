package my.custodyreconciler.app.repository;

import my.custodyreconciler.app.domain.AppUser;
import my.custodyreconciler.app.domain.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {
	Optional<AppUser> findByUsername(String username);

	List<AppUser> findByRoleInAndActiveTrue(Collection<UserRole> roles);
}
