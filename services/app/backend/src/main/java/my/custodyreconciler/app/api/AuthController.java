package my.custodyreconciler.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.custodyreconciler.app.config.AppProperties;
import my.custodyreconciler.app.dto.AuthRequest;
import my.custodyreconciler.app.dto.AuthResponse;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Authentication")
public class AuthController {
	private final AuthenticationManager authenticationManager;
	private final JwtEncoder jwtEncoder;
	private final AppProperties properties;

	public AuthController(AuthenticationManager authenticationManager, JwtEncoder jwtEncoder, AppProperties properties) {
		this.authenticationManager = authenticationManager;
		this.jwtEncoder = jwtEncoder;
		this.properties = properties;
	}

	@PostMapping("/token")
	@Operation(summary = "Exchange operator credentials for a bearer token")
	public AuthResponse token(@Valid @RequestBody AuthRequest request) {
		Authentication authentication;
		try {
			authentication = authenticationManager.authenticate(
					new UsernamePasswordAuthenticationToken(request.username(), request.password())
			);
		} catch (AuthenticationException ex) {
			throw new IllegalArgumentException("Invalid credentials", ex);
		}
		List<String> roles = authentication.getAuthorities().stream()
				.map(GrantedAuthority::getAuthority)
				.map(authority -> authority.startsWith("ROLE_") ? authority.substring(5) : authority)
				.toList();
		Instant now = Instant.now();
		long expiresIn = properties.jwt().tokenTtl().toSeconds();
		JwtClaimsSet claims = JwtClaimsSet.builder()
				.issuer(properties.jwt().issuer())
				.subject(authentication.getName())
				.issuedAt(now)
				.expiresAt(now.plusSeconds(expiresIn))
				.claim("roles", roles)
				.build();
		JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
		String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
		return new AuthResponse(token, "Bearer", expiresIn);
	}
}
