package my.vehiclecost.app.model;

public enum MaintenanceLevel {
	LOW, NORMAL, HIGH
}
