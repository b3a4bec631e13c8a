package my.custodyreconciler.app.config;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import my.custodyreconciler.app.domain.UserRole;
import my.custodyreconciler.app.repository.AppUserRepository;
import my.custodyreconciler.app.service.AppUserDetailsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.config.annotation.authentication.configuration.AuthenticationConfiguration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.web.SecurityFilterChain;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

@Configuration
public class SecurityConfig {
	private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);
	private static final int MIN_SECRET_BYTES = 32;
	private final AppProperties properties;

	public SecurityConfig(AppProperties properties) {
		this.properties = properties;
	}

	@Bean
	public PasswordEncoder passwordEncoder() {
		return new BCryptPasswordEncoder();
	}

	@Bean
	public UserDetailsService userDetailsService(AppUserRepository appUserRepository, PasswordEncoder passwordEncoder) {
		return new AppUserDetailsService(appUserRepository, properties, passwordEncoder);
	}

	@Bean
	public AuthenticationManager authenticationManager(AuthenticationConfiguration configuration) throws Exception {
		return configuration.getAuthenticationManager();
	}

	@Bean
	public SecretKey jwtSecretKey() {
		return new SecretKeySpec(resolveJwtSecret(), "HmacSHA256");
	}

	@Bean
	public JwtEncoder jwtEncoder(SecretKey jwtSecretKey) {
		OctetSequenceKey key = new OctetSequenceKey.Builder(jwtSecretKey.getEncoded())
				.algorithm(JWSAlgorithm.HS256)
				.keyID("custody-reconciler-jwt")
				.build();
		return new NimbusJwtEncoder(new ImmutableJWKSet<>(new JWKSet(key)));
	}

	@Bean
	public JwtDecoder jwtDecoder(SecretKey jwtSecretKey) {
		var decoder = NimbusJwtDecoder.withSecretKey(jwtSecretKey).build();
		decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(properties.jwt().issuer()));
		return decoder;
	}

	@Bean
	public SecurityFilterChain securityFilterChain(HttpSecurity http,
												   JwtAuthenticationConverter jwtAuthenticationConverter) throws Exception {
		String[] operators = {UserRole.SUPERADMIN.name(), UserRole.ADMIN.name()};
		http
			.csrf(csrf -> csrf.disable())
			.sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
			.authorizeHttpRequests(auth -> auth
				.requestMatchers("/api/auth/**").permitAll()
				.requestMatchers(HttpMethod.POST, "/api/imports/**").hasAnyRole(operators)
				.requestMatchers("/swagger-ui/**", "/v3/api-docs/**", "/api/**").authenticated()
				.anyRequest().denyAll()
			)
			.oauth2ResourceServer(oauth -> oauth.jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter)));
		return http.build();
	}

	@Bean
	public JwtAuthenticationConverter jwtAuthenticationConverter() {
		JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
		converter.setJwtGrantedAuthoritiesConverter(jwt -> {
			List<GrantedAuthority> authorities = new ArrayList<>();
			addRoles(authorities, jwt.getClaim("roles"));
			return authorities;
		});
		return converter;
	}

	private void addRoles(List<GrantedAuthority> authorities, Object rolesClaim) {
		if (rolesClaim instanceof String rolesString) {
			for (String role : rolesString.split("[,\\s]+")) {
				addRole(authorities, role);
			}
		} else if (rolesClaim instanceof Collection<?> rolesCollection) {
			for (Object role : rolesCollection) {
				addRole(authorities, role == null ? null : role.toString());
			}
		}
	}

	private void addRole(List<GrantedAuthority> authorities, String role) {
		if (role == null || role.isBlank()) {
			return;
		}
		String normalized = role.trim().toUpperCase(Locale.ROOT);
		authorities.add(new SimpleGrantedAuthority(normalized.startsWith("ROLE_") ? normalized : "ROLE_" + normalized));
	}

	private byte[] resolveJwtSecret() {
		String configured = properties.jwt().secret();
		if (configured == null || configured.isBlank()) {
			logger.warn("JWT secret not configured. Generating a runtime secret, tokens will not survive a restart.");
			return generateSecret();
		}
		byte[] secret = configured.getBytes(StandardCharsets.UTF_8);
		if (secret.length < MIN_SECRET_BYTES) {
			logger.warn("Configured JWT secret is shorter than {} bytes. Generating a runtime secret.", MIN_SECRET_BYTES);
			return generateSecret();
		}
		return secret;
	}

	private byte[] generateSecret() {
		byte[] secret = new byte[MIN_SECRET_BYTES];
		new SecureRandom().nextBytes(secret);
		return secret;
	}
}
