package my.vehiclecost.app.model;

public enum DepreciationLevel {
	LOW, NORMAL, HIGH
}
