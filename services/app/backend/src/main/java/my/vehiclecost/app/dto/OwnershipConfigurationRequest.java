package my.vehiclecost.app.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.PositiveOrZero;
import my.vehiclecost.app.model.DepreciationLevel;
import my.vehiclecost.app.model.FinancingType;
import my.vehiclecost.app.model.LeasingType;
import my.vehiclecost.app.model.LoanType;
import my.vehiclecost.app.model.MaintenanceLevel;
import my.vehiclecost.app.model.OwnershipConfiguration;
import my.vehiclecost.app.model.VehicleSize;

public record OwnershipConfigurationRequest(
		@PositiveOrZero Double annualMileage,
		@PositiveOrZero Double primaryFuelPrice,
		@PositiveOrZero Double secondaryFuelPrice,
		@PositiveOrZero @DecimalMax("100") Double secondaryFuelShare,
		VehicleSize vehicleSize,
		MaintenanceLevel maintenanceLevel,
		DepreciationLevel depreciationLevel,
		@PositiveOrZero @Max(50) Integer ownershipYears,
		@PositiveOrZero Double insurance,
		@PositiveOrZero Double parking,
		@PositiveOrZero Double ancillaryCare,
		FinancingType financingType,
		LoanType loanType,
		@PositiveOrZero @DecimalMax("100") Double downPaymentPercent,
		@PositiveOrZero @DecimalMax("100") Double residualValuePercent,
		@PositiveOrZero Double interestRate,
		@PositiveOrZero @Max(50) Integer loanYears,
		@PositiveOrZero Double monthlyAdminFee,
		LeasingType leasingType,
		@PositiveOrZero Double monthlyLeasingFee,
		Boolean leasingIncludesInsurance,
		@PositiveOrZero Double annualTax,
		Boolean hasMalusTax,
		@PositiveOrZero Double malusTaxAmount,
		@PositiveOrZero Double annualTireCost
) {
	public OwnershipConfiguration toConfiguration() {
		OwnershipConfiguration configuration = new OwnershipConfiguration();
		configuration.setAnnualMileage(annualMileage);
		configuration.setPrimaryFuelPrice(primaryFuelPrice);
		configuration.setSecondaryFuelPrice(secondaryFuelPrice);
		configuration.setSecondaryFuelShare(secondaryFuelShare);
		configuration.setVehicleSize(vehicleSize);
		configuration.setMaintenanceLevel(maintenanceLevel);
		configuration.setDepreciationLevel(depreciationLevel);
		configuration.setOwnershipYears(ownershipYears);
		configuration.setInsurance(insurance);
		configuration.setParking(parking);
		configuration.setAncillaryCare(ancillaryCare);
		configuration.setFinancingType(financingType);
		configuration.setLoanType(loanType);
		configuration.setDownPaymentPercent(downPaymentPercent);
		configuration.setResidualValuePercent(residualValuePercent);
		configuration.setInterestRate(interestRate);
		configuration.setLoanYears(loanYears);
		configuration.setMonthlyAdminFee(monthlyAdminFee);
		configuration.setLeasingType(leasingType);
		configuration.setMonthlyLeasingFee(monthlyLeasingFee);
		configuration.setLeasingIncludesInsurance(leasingIncludesInsurance);
		configuration.setAnnualTax(annualTax);
		configuration.setHasMalusTax(hasMalusTax);
		configuration.setMalusTaxAmount(malusTaxAmount);
		configuration.setAnnualTireCost(annualTireCost);
		return configuration;
	}
}
