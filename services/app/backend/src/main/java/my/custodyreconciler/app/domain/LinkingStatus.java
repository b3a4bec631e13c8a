package my.custodyreconciler.app.domain;

public enum LinkingStatus {
	UNLINKED,
	LINKED
}
