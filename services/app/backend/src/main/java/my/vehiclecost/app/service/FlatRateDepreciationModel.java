package my.vehiclecost.app.service;

import my.vehiclecost.app.model.CostTables;
import my.vehiclecost.app.model.DepreciationLevel;
import my.vehiclecost.app.model.FlatDepreciationRate;
import my.vehiclecost.app.model.FuelType;

/**
 * Two-tier model: one rate for the first ownership year and one for every later year. Ignores vehicle
 * age and fuel type.
 */
public class FlatRateDepreciationModel implements DepreciationModel {
	private final CostTables tables;

	public FlatRateDepreciationModel(CostTables tables) {
		this.tables = tables;
	}

	@Override
	public double rateFor(int ageAtYearStart, int ownershipYear, FuelType fuelType, DepreciationLevel level) {
		FlatDepreciationRate rates = tables.flatDepreciationRates().get(level);
		if (rates == null) {
			rates = tables.flatDepreciationRates().get(DepreciationLevel.NORMAL);
		}
		if (rates == null) {
			return 0.0;
		}
		return DepreciationModel.clampRate(ownershipYear == 0 ? rates.firstYear() : rates.laterYears());
	}
}
