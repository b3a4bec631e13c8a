package my.custodyreconciler.app.api;

import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.config.SecurityConfig;
import my.custodyreconciler.app.dto.AuthRequest;
import my.custodyreconciler.app.dto.AuthResponse;
import my.custodyreconciler.app.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import javax.crypto.SecretKey;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AuthControllerTest {
	private final AuthenticationManager authenticationManager = mock(AuthenticationManager.class);
	private JwtDecoder jwtDecoder;
	private AuthController controller;

	@BeforeEach
	void setUp() {
		AppProperties properties = TestProperties.defaults();
		SecurityConfig securityConfig = new SecurityConfig(properties);
		SecretKey key = securityConfig.jwtSecretKey();
		jwtDecoder = securityConfig.jwtDecoder(key);
		controller = new AuthController(authenticationManager, securityConfig.jwtEncoder(key), properties);
	}

	@Test
	void issuesTokenCarryingRolesWithoutPrefix() {
		Authentication authenticated = UsernamePasswordAuthenticationToken.authenticated(
				"ops", null, List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
		when(authenticationManager.authenticate(any())).thenReturn(authenticated);

		AuthResponse response = controller.token(new AuthRequest("ops", "pw"));

		assertThat(response.tokenType()).isEqualTo("Bearer");
		assertThat(response.expiresIn()).isEqualTo(3600);
		Jwt jwt = jwtDecoder.decode(response.accessToken());
		assertThat(jwt.getSubject()).isEqualTo("ops");
		assertThat(jwt.getClaimAsString("iss")).isEqualTo("custody-reconciler");
		assertThat(jwt.getClaimAsStringList("roles")).containsExactly("ADMIN");
	}

	@Test
	void badCredentialsBecomeIllegalArgument() {
		when(authenticationManager.authenticate(any())).thenThrow(new BadCredentialsException("Bad credentials"));

		assertThatThrownBy(() -> controller.token(new AuthRequest("ops", "wrong")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Invalid credentials");
	}
}
