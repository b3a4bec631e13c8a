package my.custodyreconciler.app.service;

import my.custodyreconciler.app.domain.AppUser;
import my.custodyreconciler.app.domain.UserRole;
import my.custodyreconciler.app.repository.AppUserRepository;
import my.custodyreconciler.app.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AppUserDetailsServiceTest {
	private final AppUserRepository appUserRepository = mock(AppUserRepository.class);
	private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
	private AppUserDetailsService service;

	@BeforeEach
	void setUp() {
		service = new AppUserDetailsService(appUserRepository, TestProperties.defaults(), passwordEncoder);
	}

	@Test
	void bootstrapAdminIsSuperadminWithoutDatabaseLookup() {
		UserDetails details = service.loadUserByUsername("admin");

		assertThat(details.getAuthorities()).extracting(GrantedAuthority::getAuthority)
				.containsExactly("ROLE_SUPERADMIN");
		assertThat(passwordEncoder.matches("secret", details.getPassword())).isTrue();
		verifyNoInteractions(appUserRepository);
	}

	@Test
	void activeUserLoadsWithStoredRole() {
		AppUser user = user("rm.mueller", UserRole.RELATIONSHIP_MANAGER, "$2a$04$hash", true);
		when(appUserRepository.findByUsername("rm.mueller")).thenReturn(Optional.of(user));

		UserDetails details = service.loadUserByUsername("rm.mueller");

		assertThat(details.getUsername()).isEqualTo("rm.mueller");
		assertThat(details.getPassword()).isEqualTo("$2a$04$hash");
		assertThat(details.getAuthorities()).extracting(GrantedAuthority::getAuthority)
				.containsExactly("ROLE_RELATIONSHIP_MANAGER");
	}

	@Test
	void inactiveUserIsRejected() {
		when(appUserRepository.findByUsername("ops")).thenReturn(Optional.of(user("ops", UserRole.ADMIN, "$2a$04$hash", false)));

		assertThatThrownBy(() -> service.loadUserByUsername("ops"))
				.isInstanceOf(UsernameNotFoundException.class);
	}

	@Test
	void userWithoutPasswordCannotLogIn() {
		when(appUserRepository.findByUsername("client")).thenReturn(Optional.of(user("client", UserRole.CLIENT, null, true)));

		assertThatThrownBy(() -> service.loadUserByUsername("client"))
				.isInstanceOf(UsernameNotFoundException.class);
	}

	@Test
	void unknownUserIsRejected() {
		when(appUserRepository.findByUsername("nobody")).thenReturn(Optional.empty());

		assertThatThrownBy(() -> service.loadUserByUsername("nobody"))
				.isInstanceOf(UsernameNotFoundException.class)
				.hasMessageContaining("nobody");
	}

	private AppUser user(String username, UserRole role, String passwordHash, boolean active) {
		AppUser user = new AppUser();
		user.setUsername(username);
		user.setRole(role);
		user.setPasswordHash(passwordHash);
		user.setActive(active);
		return user;
	}
}
