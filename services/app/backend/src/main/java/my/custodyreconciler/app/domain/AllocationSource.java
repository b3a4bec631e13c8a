package my.custodyreconciler.app.domain;

public enum AllocationSource {
	BANK_AUTO,
	MANUAL
}
