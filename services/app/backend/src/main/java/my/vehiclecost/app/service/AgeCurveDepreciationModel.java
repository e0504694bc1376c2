package my.vehiclecost.app.service;

import my.vehiclecost.app.model.CostTables;
import my.vehiclecost.app.model.DepreciationBracket;
import my.vehiclecost.app.model.DepreciationLevel;
import my.vehiclecost.app.model.FuelType;

import java.util.List;

/**
 * Rate from the age bracket the vehicle is in at the start of each ownership year, scaled by how the
 * fuel type holds its value and by the user's risk adjustment.
 */
public class AgeCurveDepreciationModel implements DepreciationModel {
	private final CostTables tables;

	public AgeCurveDepreciationModel(CostTables tables) {
		this.tables = tables;
	}

	public double baseRateForAge(int age) {
		List<DepreciationBracket> curve = tables.depreciationCurve();
		for (DepreciationBracket bracket : curve) {
			if (age < bracket.maxAge()) {
				return bracket.rate();
			}
		}
		return curve.get(curve.size() - 1).rate();
	}

	@Override
	public double rateFor(int ageAtYearStart, int ownershipYear, FuelType fuelType, DepreciationLevel level) {
		double rate = baseRateForAge(ageAtYearStart)
				* tables.fuelDepreciationMultiplier(fuelType)
				* tables.depreciationOverrideFactor(level);
		return DepreciationModel.clampRate(rate);
	}
}
