package my.custodyreconciler.app.domain;

public enum HoldingStatus {
	ACTIVE,
	SOLD,
	SUPERSEDED
}
