package my.custodyreconciler.app.domain;

public enum UserRole {
	SUPERADMIN,
	ADMIN,
	RELATIONSHIP_MANAGER,
	CLIENT;

	public boolean isAdmin() {
		return this == SUPERADMIN || this == ADMIN;
	}
}
