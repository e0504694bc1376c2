package my.vehiclecost.app.model;

/**
 * Fully resolved input of the cost calculator. Monetary amounts for insurance, parking and ancillary
 * care are monthly; mileage is in mil (10 km) per year; consumption is per mil.
 *
 * @param vehicleAge age at purchase in years, {@code null} when the model year was unknown
 * @param secondaryFuel {@code null} unless the vehicle blends two energy sources
 * @param annualTireCost user override, {@code null} to derive it from mileage
 */
public record NormalizedComputationInput(double purchasePrice,
										 FuelType fuelType,
										 double fuelConsumption,
										 boolean consumptionEstimated,
										 double primaryFuelPrice,
										 SecondaryFuel secondaryFuel,
										 double annualMileage,
										 VehicleSize vehicleSize,
										 MaintenanceLevel maintenanceLevel,
										 DepreciationLevel depreciationLevel,
										 Integer vehicleAge,
										 int ownershipYears,
										 double insurance,
										 double parking,
										 double ancillaryCare,
										 FinancingPlan financing,
										 double annualTax,
										 TaxSource taxSource,
										 boolean hasMalusTax,
										 double malusTaxAmount,
										 Double annualTireCost) {

	public boolean hasSecondaryFuel() {
		return secondaryFuel != null;
	}

	public double secondaryFuelShare() {
		return secondaryFuel == null ? 0.0 : secondaryFuel.sharePercent();
	}

	public double annualMileageKm() {
		return annualMileage * 10;
	}

	/**
	 * @param sharePercent part of the distance driven on this fuel, 0-100
	 */
	public record SecondaryFuel(FuelType fuelType, double price, double sharePercent) {
	}
}
