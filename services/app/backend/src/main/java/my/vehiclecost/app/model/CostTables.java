package my.vehiclecost.app.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Constants of the cost model. Instances are immutable and passed explicitly to the engines.
 *
 * @param depreciationCurve brackets ordered by ascending {@code maxAge}; the last one applies to all older vehicles
 * @param maintenanceReferenceMileage annual mileage (mil) the maintenance table is quoted for
 * @param tireLifetimeKm distance a set of tires lasts
 * @param fallbackAnnualTax tax used when neither listing, user nor the fuel table provide one
 */
public record CostTables(List<DepreciationBracket> depreciationCurve,
						 Map<FuelType, Double> fuelDepreciationMultipliers,
						 Map<DepreciationLevel, Double> depreciationOverrideFactors,
						 Map<DepreciationLevel, FlatDepreciationRate> flatDepreciationRates,
						 Map<VehicleSize, Map<MaintenanceLevel, Double>> maintenanceCosts,
						 Map<VehicleSize, Double> tireCosts,
						 Map<FuelType, Double> defaultTaxByFuel,
						 Map<FuelType, Double> estimatedConsumption,
						 double maintenanceReferenceMileage,
						 double tireLifetimeKm,
						 double minTireReplacementYears,
						 double maxTireReplacementYears,
						 double fallbackAnnualTax,
						 MalusRule malus) {
	public CostTables {
		if (depreciationCurve == null || depreciationCurve.isEmpty()) {
			throw new IllegalArgumentException("Depreciation curve must contain at least one bracket");
		}
		depreciationCurve = List.copyOf(depreciationCurve);
		fuelDepreciationMultipliers = Map.copyOf(fuelDepreciationMultipliers);
		depreciationOverrideFactors = Map.copyOf(depreciationOverrideFactors);
		flatDepreciationRates = Map.copyOf(flatDepreciationRates);
		Map<VehicleSize, Map<MaintenanceLevel, Double>> maintenance = new EnumMap<>(VehicleSize.class);
		maintenanceCosts.forEach((size, levels) -> maintenance.put(size, Map.copyOf(levels)));
		maintenanceCosts = Map.copyOf(maintenance);
		tireCosts = Map.copyOf(tireCosts);
		defaultTaxByFuel = Map.copyOf(defaultTaxByFuel);
		estimatedConsumption = Map.copyOf(estimatedConsumption);
	}

	public static CostTables defaults() {
		return new CostTables(
				List.of(
						new DepreciationBracket(1, 0.25),
						new DepreciationBracket(3, 0.15),
						new DepreciationBracket(5, 0.10),
						new DepreciationBracket(8, 0.06),
						new DepreciationBracket(Integer.MAX_VALUE, 0.04)
				),
				Map.of(
						FuelType.GASOLINE, 0.75,
						FuelType.DIESEL, 1.00,
						FuelType.HYBRID, 0.80,
						FuelType.PLUG_IN_HYBRID, 0.90,
						FuelType.ELECTRIC, 1.25,
						FuelType.ETHANOL_BLEND, 1.10,
						FuelType.BIOGAS, 1.10
				),
				Map.of(
						DepreciationLevel.LOW, 0.75,
						DepreciationLevel.NORMAL, 1.00,
						DepreciationLevel.HIGH, 1.30
				),
				Map.of(
						DepreciationLevel.LOW, new FlatDepreciationRate(0.10, 0.08),
						DepreciationLevel.NORMAL, new FlatDepreciationRate(0.15, 0.12),
						DepreciationLevel.HIGH, new FlatDepreciationRate(0.20, 0.15)
				),
				Map.of(
						VehicleSize.SIMPLE, levels(3000, 5000, 8000),
						VehicleSize.NORMAL, levels(5000, 8000, 12000),
						VehicleSize.LARGE, levels(8000, 12000, 18000),
						VehicleSize.LUXURY, levels(12000, 20000, 35000)
				),
				Map.of(
						VehicleSize.SIMPLE, 4000.0,
						VehicleSize.NORMAL, 6000.0,
						VehicleSize.LARGE, 10000.0,
						VehicleSize.LUXURY, 15000.0
				),
				Map.of(
						FuelType.GASOLINE, 2000.0,
						FuelType.DIESEL, 2500.0,
						FuelType.ELECTRIC, 360.0,
						FuelType.HYBRID, 1500.0,
						FuelType.PLUG_IN_HYBRID, 1200.0,
						FuelType.ETHANOL_BLEND, 1800.0,
						FuelType.BIOGAS, 1500.0
				),
				Map.of(
						FuelType.GASOLINE, 0.7,
						FuelType.DIESEL, 0.6,
						FuelType.ELECTRIC, 2.0,
						FuelType.HYBRID, 0.5,
						FuelType.PLUG_IN_HYBRID, 0.4,
						FuelType.ETHANOL_BLEND, 0.9,
						FuelType.BIOGAS, 0.8
				),
				1500,
				60000,
				2,
				5,
				2000,
				new MalusRule(2018, 3, 75, 107)
		);
	}

	public double fuelDepreciationMultiplier(FuelType fuelType) {
		return fuelDepreciationMultipliers.getOrDefault(fuelType, 1.0);
	}

	public double depreciationOverrideFactor(DepreciationLevel level) {
		return depreciationOverrideFactors.getOrDefault(level, 1.0);
	}

	public double maintenanceCost(VehicleSize size, MaintenanceLevel level) {
		Map<MaintenanceLevel, Double> byLevel = maintenanceCosts.get(size);
		if (byLevel == null) {
			byLevel = maintenanceCosts.get(VehicleSize.NORMAL);
		}
		return byLevel == null ? 0.0 : byLevel.getOrDefault(level, 0.0);
	}

	public double tireCost(VehicleSize size) {
		Double cost = tireCosts.get(size);
		return cost == null ? tireCosts.getOrDefault(VehicleSize.NORMAL, 0.0) : cost;
	}

	public double defaultTax(FuelType fuelType) {
		return defaultTaxByFuel.getOrDefault(fuelType, fallbackAnnualTax);
	}

	public double estimatedConsumption(FuelType fuelType) {
		Double estimate = estimatedConsumption.get(fuelType);
		return estimate == null ? estimatedConsumption.getOrDefault(FuelType.GASOLINE, 0.0) : estimate;
	}

	private static Map<MaintenanceLevel, Double> levels(double low, double normal, double high) {
		return Map.of(
				MaintenanceLevel.LOW, low,
				MaintenanceLevel.NORMAL, normal,
				MaintenanceLevel.HIGH, high
		);
	}

	/**
	 * Emission surcharge for new vehicles: {@code ratePerGram} for every g/km above {@code co2Threshold}
	 * during the first {@code years} years, for model years from {@code firstModelYear}.
	 */
	public record MalusRule(int firstModelYear, int years, double co2Threshold, double ratePerGram) {
	}
}
