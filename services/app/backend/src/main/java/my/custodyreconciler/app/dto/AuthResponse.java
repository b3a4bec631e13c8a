package my.custodyreconciler.app.dto;

public record AuthResponse(String accessToken, String tokenType, long expiresIn) {
}
