package my.vehiclecost.app.service;

import my.vehiclecost.app.model.DepreciationLevel;
import my.vehiclecost.app.model.FuelType;

/**
 * Value loss of a vehicle over the ownership period. Implementations apply a declining balance:
 * each year loses {@code value * rate} of the value remaining at the start of that year.
 */
public interface DepreciationModel {

	/**
	 * Effective rate for one ownership year, already clamped to [0, 1].
	 *
	 * @param ageAtYearStart vehicle age at the start of the ownership year
	 * @param ownershipYear zero-based index of the ownership year
	 */
	double rateFor(int ageAtYearStart, int ownershipYear, FuelType fuelType, DepreciationLevel level);

	default double totalDepreciation(double purchasePrice,
									 FuelType fuelType,
									 DepreciationLevel level,
									 Integer vehicleAge,
									 int ownershipYears) {
		int startAge = vehicleAge == null ? 0 : vehicleAge;
		double total = 0.0;
		double value = purchasePrice;
		for (int year = 0; year < ownershipYears; year++) {
			double loss = value * rateFor(startAge + year, year, fuelType, level);
			total += loss;
			value -= loss;
		}
		return total;
	}

	default double annualDepreciation(double purchasePrice,
									  FuelType fuelType,
									  DepreciationLevel level,
									  Integer vehicleAge,
									  int ownershipYears) {
		if (ownershipYears <= 0) {
			return 0.0;
		}
		return totalDepreciation(purchasePrice, fuelType, level, vehicleAge, ownershipYears) / ownershipYears;
	}

	static double clampRate(double rate) {
		return Math.min(1.0, Math.max(0.0, rate));
	}
}
