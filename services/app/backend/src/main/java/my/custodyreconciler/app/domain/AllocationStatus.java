package my.custodyreconciler.app.domain;

public enum AllocationStatus {
	ACTIVE,
	REDEEMED
}
