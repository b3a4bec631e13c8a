package my.custodyreconciler.app.model;

public enum AllocationCategory {
	CASH("Cash"),
	BONDS("Bonds"),
	EQUITIES("Equities"),
	ALTERNATIVE("Alternative");

	private final String label;

	AllocationCategory(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
