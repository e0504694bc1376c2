package my.vehiclecost.app.model;

public enum LeasingType {
	PRIVATE, BUSINESS
}
