package my.vehiclecost.app.service;

import my.vehiclecost.app.model.CostBreakdown;
import my.vehiclecost.app.model.CostTables;
import my.vehiclecost.app.model.FinancingPlan;
import my.vehiclecost.app.model.NormalizedComputationInput;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Annual cost of ownership for a resolved input. Stateless; never throws for structurally valid input.
 */
@Service
public class CostCalculator {
	private static final int MONTHS_PER_YEAR = 12;
	private static final double KM_PER_MIL = 10.0;

	private final CostTables tables;
	private final DepreciationModel depreciationModel;
	private final FinancingCalculator financingCalculator;

	public CostCalculator(CostTables tables,
						  DepreciationModel depreciationModel,
						  FinancingCalculator financingCalculator) {
		this.tables = tables;
		this.depreciationModel = depreciationModel;
		this.financingCalculator = financingCalculator;
	}

	public CostBreakdown calculate(NormalizedComputationInput input) {
		double mileageKm = input.annualMileageKm();

		double fuel = fuelCostPerKm(input) * mileageKm;
		double depreciation = depreciationModel.annualDepreciation(
				input.purchasePrice(),
				input.fuelType(),
				input.depreciationLevel(),
				input.vehicleAge(),
				input.ownershipYears());
		double tax = input.annualTax() + (input.hasMalusTax() ? input.malusTaxAmount() : 0.0);
		double maintenance = tables.maintenanceCost(input.vehicleSize(), input.maintenanceLevel())
				* (input.annualMileage() / tables.maintenanceReferenceMileage());
		double tires = annualTireCost(input, mileageKm);

		boolean insuranceInLease = input.financing() instanceof FinancingPlan.Leasing leasing
				&& leasing.includesInsurance();
		double insurance = insuranceInLease ? 0.0 : input.insurance() * MONTHS_PER_YEAR;
		double parking = input.parking() * MONTHS_PER_YEAR;
		double ancillaryCare = input.ancillaryCare() * MONTHS_PER_YEAR;
		FinancingCalculator.FinancingCost financing = financingCalculator.calculate(input.financing(), input.purchasePrice());

		double variableCosts = fuel + maintenance + tires;
		double fixedCosts = tax + insurance + parking + ancillaryCare + financing.annualCost() + depreciation;
		double totalAnnual = variableCosts + fixedCosts;
		double costPerMil = input.annualMileage() > 0 ? totalAnnual / input.annualMileage() : 0.0;
		double costPerKm = mileageKm > 0 ? totalAnnual / mileageKm : 0.0;

		return new CostBreakdown(
				Math.round(fuel),
				Math.round(depreciation),
				Math.round(tax),
				Math.round(maintenance),
				Math.round(tires),
				Math.round(insurance),
				Math.round(parking),
				Math.round(ancillaryCare),
				financing.annualCost(),
				financing.monthlyPayment(),
				Math.round(variableCosts),
				Math.round(fixedCosts),
				Math.round(totalAnnual),
				Math.round(costPerMil),
				formatPerKm(costPerKm),
				Math.round(totalAnnual / MONTHS_PER_YEAR)
		);
	}

	/**
	 * Consumption is per mil; a blended vehicle uses the same consumption figure for both energy sources.
	 */
	static double fuelCostPerKm(NormalizedComputationInput input) {
		double consumption = input.fuelConsumption();
		if (!input.hasSecondaryFuel()) {
			return consumption * input.primaryFuelPrice() / KM_PER_MIL;
		}
		double secondaryShare = input.secondaryFuelShare() / 100;
		double primaryShare = (100 - input.secondaryFuelShare()) / 100;
		return (consumption * input.primaryFuelPrice() * primaryShare
				+ consumption * input.secondaryFuel().price() * secondaryShare) / KM_PER_MIL;
	}

	double annualTireCost(NormalizedComputationInput input, double mileageKm) {
		Double override = input.annualTireCost();
		if (override != null && override > 0) {
			return override;
		}
		double replacementYears = mileageKm > 0
				? Math.max(tables.minTireReplacementYears(),
						Math.min(tables.maxTireReplacementYears(), tables.tireLifetimeKm() / mileageKm))
				: tables.maxTireReplacementYears();
		return tables.tireCost(input.vehicleSize()) / replacementYears;
	}

	/**
	 * Rounds the exact binary value of the double, so 1.005 (stored as 1.00499...) becomes "1.00".
	 */
	static String formatPerKm(double costPerKm) {
		if (Double.isNaN(costPerKm) || Double.isInfinite(costPerKm)) {
			return "0.00";
		}
		return new BigDecimal(costPerKm).setScale(2, RoundingMode.HALF_UP).toPlainString();
	}
}
