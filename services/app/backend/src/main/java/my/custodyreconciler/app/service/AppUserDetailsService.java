package my.custodyreconciler.app.service;

import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.domain.AppUser;
import my.custodyreconciler.app.domain.UserRole;
import my.custodyreconciler.app.repository.AppUserRepository;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Operators come from {@code app_users}; the configured bootstrap admin is always accepted so a fresh
 * database can be administered.
 */
public class AppUserDetailsService implements UserDetailsService {
	private final AppUserRepository appUserRepository;
	private final AppProperties.Security bootstrap;
	private final String bootstrapPasswordHash;

	public AppUserDetailsService(AppUserRepository appUserRepository, AppProperties properties,
								 PasswordEncoder passwordEncoder) {
		this.appUserRepository = appUserRepository;
		this.bootstrap = properties.security();
		this.bootstrapPasswordHash = passwordEncoder.encode(bootstrap.adminPass());
	}

	@Override
	public UserDetails loadUserByUsername(String username) {
		if (bootstrap.adminUser().equals(username)) {
			return User.withUsername(username)
					.password(bootstrapPasswordHash)
					.roles(UserRole.SUPERADMIN.name())
					.build();
		}
		AppUser user = appUserRepository.findByUsername(username)
				.filter(AppUser::isActive)
				.filter(candidate -> candidate.getPasswordHash() != null)
				.orElseThrow(() -> new UsernameNotFoundException("Unknown user: " + username));
		return User.withUsername(user.getUsername())
				.password(user.getPasswordHash())
				.roles(user.getRole().name())
				.build();
	}
}
