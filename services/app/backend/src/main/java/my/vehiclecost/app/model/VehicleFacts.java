package my.vehiclecost.app.model;

/**
 * Facts about a single listing as delivered by the page extractor. Everything except price and fuel
 * type is optional.
 */
public record VehicleFacts(double purchasePrice,
						   String fuelType,
						   String fuelTypeLabel,
						   Double fuelConsumption,
						   Integer modelYear,
						   Integer mileage,
						   Integer enginePower,
						   Integer co2Emissions,
						   VehicleSize vehicleSize,
						   String vehicleName,
						   Double effectiveInterestRate,
						   Double annualTax,
						   EstimatedFields estimated) {
	public VehicleFacts {
		if (estimated == null) {
			estimated = EstimatedFields.NONE;
		}
	}

	public static VehicleFacts of(double purchasePrice, String fuelType) {
		return new VehicleFacts(purchasePrice, fuelType, null, null, null, null, null, null,
				null, null, null, null, EstimatedFields.NONE);
	}

	public record EstimatedFields(boolean fuelConsumption, boolean vehicleSize) {
		public static final EstimatedFields NONE = new EstimatedFields(false, false);
	}
}
