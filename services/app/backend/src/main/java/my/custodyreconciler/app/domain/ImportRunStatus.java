package my.custodyreconciler.app.domain;

public enum ImportRunStatus {
	STARTED,
	COMPLETED,
	COMPLETED_WITH_ISSUES,
	FAILED
}
