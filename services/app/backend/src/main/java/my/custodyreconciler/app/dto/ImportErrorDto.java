package my.custodyreconciler.app.dto;

public record ImportErrorDto(String portfolioCode,
							 String isin,
							 String error) {
}
