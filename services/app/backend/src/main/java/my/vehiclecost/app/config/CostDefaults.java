package my.vehiclecost.app.config;

import my.vehiclecost.app.model.DepreciationLevel;
import my.vehiclecost.app.model.FinancingType;
import my.vehiclecost.app.model.LeasingType;
import my.vehiclecost.app.model.LoanType;
import my.vehiclecost.app.model.MaintenanceLevel;
import my.vehiclecost.app.model.VehicleSize;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Values used for every ownership setting the user has not provided. Bound from {@code app.defaults}.
 * {@code annualTax} doubles as the marker for "not customized": a user value equal to it is replaced
 * by the fuel-type default.
 */
public record CostDefaults(
		@DefaultValue("1500") double annualMileage,
		@DefaultValue("18.5") double primaryFuelPrice,
		@DefaultValue("2.5") double secondaryFuelPrice,
		@DefaultValue("50") double secondaryFuelShare,
		@DefaultValue("NORMAL") VehicleSize vehicleSize,
		@DefaultValue("NORMAL") MaintenanceLevel maintenanceLevel,
		@DefaultValue("NORMAL") DepreciationLevel depreciationLevel,
		@DefaultValue("5") int ownershipYears,
		@DefaultValue("500") double insurance,
		@DefaultValue("0") double parking,
		@DefaultValue("250") double ancillaryCare,
		@DefaultValue("CASH") FinancingType financingType,
		@DefaultValue("RESIDUAL") LoanType loanType,
		@DefaultValue("20") double downPaymentPercent,
		@DefaultValue("50") double residualValuePercent,
		@DefaultValue("5.0") double interestRate,
		@DefaultValue("3") int loanYears,
		@DefaultValue("60") double monthlyAdminFee,
		@DefaultValue("PRIVATE") LeasingType leasingType,
		@DefaultValue("3500") double monthlyLeasingFee,
		@DefaultValue("false") boolean leasingIncludesInsurance,
		@DefaultValue("2000") double annualTax,
		@DefaultValue("false") boolean hasMalusTax,
		@DefaultValue("0") double malusTaxAmount
) {
	public static CostDefaults standard() {
		return new CostDefaults(1500, 18.5, 2.5, 50,
				VehicleSize.NORMAL, MaintenanceLevel.NORMAL, DepreciationLevel.NORMAL,
				5, 500, 0, 250,
				FinancingType.CASH, LoanType.RESIDUAL, 20, 50, 5.0, 3, 60,
				LeasingType.PRIVATE, 3500, false,
				2000, false, 0);
	}
}
