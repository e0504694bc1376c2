package my.vehiclecost.app.model;

public enum VehicleSize {
	SIMPLE, NORMAL, LARGE, LUXURY
}
