package my.vehiclecost.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import my.vehiclecost.app.model.FinancingPlan;
import my.vehiclecost.app.model.FinancingType;
import my.vehiclecost.app.model.FuelType;
import my.vehiclecost.app.model.LoanType;
import my.vehiclecost.app.model.NormalizedComputationInput;
import my.vehiclecost.app.model.TaxSource;
import my.vehiclecost.app.model.VehicleSize;

@Schema(description = "Resolved inputs a cost estimate was computed from, including applied defaults")
public record CostAssumptionsDto(
		double purchasePrice,
		FuelType fuelType,
		double fuelConsumption,
		@Schema(description = "True when consumption came from the per-fuel estimate table")
		boolean consumptionEstimated,
		double primaryFuelPrice,
		Double secondaryFuelPrice,
		double secondaryFuelShare,
		double annualMileage,
		VehicleSize vehicleSize,
		@Schema(description = "Age at purchase in years; absent when the model year is unknown")
		Integer vehicleAge,
		int ownershipYears,
		FinancingType financingType,
		LoanType loanType,
		Double interestRate,
		double annualTax,
		TaxSource taxSource,
		boolean hasMalusTax,
		double malusTaxAmount
) {
	public static CostAssumptionsDto from(NormalizedComputationInput input) {
		FinancingPlan financing = input.financing();
		FinancingPlan.Loan loan = financing instanceof FinancingPlan.Loan value ? value : null;
		return new CostAssumptionsDto(
				input.purchasePrice(),
				input.fuelType(),
				input.fuelConsumption(),
				input.consumptionEstimated(),
				input.primaryFuelPrice(),
				input.hasSecondaryFuel() ? input.secondaryFuel().price() : null,
				input.secondaryFuelShare(),
				input.annualMileage(),
				input.vehicleSize(),
				input.vehicleAge(),
				input.ownershipYears(),
				financing.type(),
				loan == null ? null : loan.loanType(),
				loan == null ? null : loan.interestRate(),
				input.annualTax(),
				input.taxSource(),
				input.hasMalusTax(),
				input.malusTaxAmount()
		);
	}
}
