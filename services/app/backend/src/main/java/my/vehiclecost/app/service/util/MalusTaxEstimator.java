package my.vehiclecost.app.service.util;

import my.vehiclecost.app.model.CostTables;

public final class MalusTaxEstimator {
	private MalusTaxEstimator() {
	}

	/**
	 * Estimated annual malus for a listing, or 0 when the vehicle is outside the malus period or the
	 * listing lacks model year or emissions.
	 */
	public static long estimate(CostTables.MalusRule rule, Integer modelYear, Integer co2Emissions, int currentYear) {
		if (rule == null || modelYear == null || co2Emissions == null) {
			return 0;
		}
		if (currentYear - modelYear > rule.years() || modelYear < rule.firstModelYear()) {
			return 0;
		}
		if (co2Emissions <= rule.co2Threshold()) {
			return 0;
		}
		return Math.round((co2Emissions - rule.co2Threshold()) * rule.ratePerGram());
	}
}
