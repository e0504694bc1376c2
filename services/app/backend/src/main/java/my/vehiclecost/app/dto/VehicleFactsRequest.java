package my.vehiclecost.app.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.vehiclecost.app.model.VehicleFacts;
import my.vehiclecost.app.model.VehicleSize;

public record VehicleFactsRequest(
		@NotNull @DecimalMin(value = "0", inclusive = false) Double purchasePrice,
		@NotBlank String fuelType,
		String fuelTypeLabel,
		@PositiveOrZero Double fuelConsumption,
		@Min(1900) @Max(2100) Integer modelYear,
		@PositiveOrZero Integer mileage,
		@PositiveOrZero Integer enginePower,
		@PositiveOrZero Integer co2Emissions,
		VehicleSize vehicleSize,
		String vehicleName,
		@PositiveOrZero Double effectiveInterestRate,
		@PositiveOrZero Double annualTax,
		Boolean fuelConsumptionEstimated,
		Boolean vehicleSizeEstimated
) {
	public VehicleFacts toFacts() {
		return new VehicleFacts(
				purchasePrice,
				fuelType,
				fuelTypeLabel,
				fuelConsumption,
				modelYear,
				mileage,
				enginePower,
				co2Emissions,
				vehicleSize,
				vehicleName,
				effectiveInterestRate,
				annualTax,
				new VehicleFacts.EstimatedFields(
						Boolean.TRUE.equals(fuelConsumptionEstimated),
						Boolean.TRUE.equals(vehicleSizeEstimated))
		);
	}
}
