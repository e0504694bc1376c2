package my.vehiclecost.app.model;

public enum FinancingType {
	CASH, LOAN, LEASING
}
