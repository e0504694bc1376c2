package my.vehiclecost.app.dto;

import my.vehiclecost.app.model.FuelType;

public record FuelTypeDto(FuelType fuelType, String key, String label, String unit, double defaultPrice) {
	public static FuelTypeDto from(FuelType fuelType) {
		return new FuelTypeDto(fuelType, fuelType.getKey(), fuelType.getLabel(), fuelType.getUnit(),
				fuelType.getDefaultPrice());
	}
}
