package my.vehiclecost.app.service;

import my.vehiclecost.app.config.CostDefaults;
import my.vehiclecost.app.model.CostTables;
import my.vehiclecost.app.model.FinancingPlan;
import my.vehiclecost.app.model.FinancingType;
import my.vehiclecost.app.model.FuelType;
import my.vehiclecost.app.model.LeasingType;
import my.vehiclecost.app.model.LoanType;
import my.vehiclecost.app.model.NormalizedComputationInput;
import my.vehiclecost.app.model.OwnershipConfiguration;
import my.vehiclecost.app.model.TaxSource;
import my.vehiclecost.app.model.VehicleFacts;
import my.vehiclecost.app.model.VehicleSize;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputAssemblerTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T10:00:00Z"), ZoneOffset.UTC);

	private final InputAssembler assembler = new InputAssembler(CostTables.defaults(), CostDefaults.standard(), CLOCK);

	@Test
	void rejectsMissingFacts() {
		assertThatThrownBy(() -> assembler.assemble(null, new OwnershipConfiguration()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void emptyConfigurationFallsBackToDefaults() {
		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(250_000, "bensin"), null);

		assertThat(input.purchasePrice()).isEqualTo(250_000);
		assertThat(input.fuelType()).isEqualTo(FuelType.GASOLINE);
		assertThat(input.primaryFuelPrice()).isEqualTo(18.5);
		assertThat(input.annualMileage()).isEqualTo(1500);
		assertThat(input.insurance()).isEqualTo(500);
		assertThat(input.parking()).isZero();
		assertThat(input.ancillaryCare()).isEqualTo(250);
		assertThat(input.ownershipYears()).isEqualTo(5);
		assertThat(input.vehicleSize()).isEqualTo(VehicleSize.NORMAL);
		assertThat(input.vehicleAge()).isNull();
		assertThat(input.financing()).isEqualTo(new FinancingPlan.Cash());
		assertThat(input.annualTax()).isEqualTo(2000);
		assertThat(input.taxSource()).isEqualTo(TaxSource.FUEL_DEFAULT);
		assertThat(input.hasMalusTax()).isFalse();
		assertThat(input.annualTireCost()).isNull();
	}

	@Test
	void userValuesOverrideDefaults() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setAnnualMileage(2200.0);
		config.setInsurance(650.0);
		config.setParking(900.0);
		config.setOwnershipYears(3);
		config.setPrimaryFuelPrice(17.9);
		config.setAnnualTireCost(4000.0);

		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(250_000, "bensin"), config);

		assertThat(input.annualMileage()).isEqualTo(2200);
		assertThat(input.insurance()).isEqualTo(650);
		assertThat(input.parking()).isEqualTo(900);
		assertThat(input.ownershipYears()).isEqualTo(3);
		assertThat(input.primaryFuelPrice()).isEqualTo(17.9);
		assertThat(input.annualTireCost()).isEqualTo(4000.0);
	}

	@Test
	void listingTaxWinsOverUserTax() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setAnnualTax(999.0);

		NormalizedComputationInput input = assembler.assemble(facts("diesel", null, 2020, null, null, 3100.0), config);

		assertThat(input.annualTax()).isEqualTo(3100);
		assertThat(input.taxSource()).isEqualTo(TaxSource.LISTING);
	}

	@Test
	void customizedUserTaxWinsOverFuelDefault() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setAnnualTax(999.0);

		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(200_000, "diesel"), config);

		assertThat(input.annualTax()).isEqualTo(999);
		assertThat(input.taxSource()).isEqualTo(TaxSource.USER);
	}

	@Test
	void userTaxEqualToSystemDefaultCountsAsUnset() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setAnnualTax(2000.0);

		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(200_000, "diesel"), config);

		assertThat(input.annualTax()).isEqualTo(2500);
		assertThat(input.taxSource()).isEqualTo(TaxSource.FUEL_DEFAULT);
	}

	@Test
	void zeroListingTaxIsIgnored() {
		NormalizedComputationInput input = assembler.assemble(facts("el", null, null, null, null, 0.0), null);

		assertThat(input.annualTax()).isEqualTo(360);
		assertThat(input.taxSource()).isEqualTo(TaxSource.FUEL_DEFAULT);
	}

	@Test
	void electricUsesSecondaryPriceAsPrimary() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setPrimaryFuelPrice(19.0);
		config.setSecondaryFuelPrice(1.8);

		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(400_000, "el"), config);

		assertThat(input.fuelType()).isEqualTo(FuelType.ELECTRIC);
		assertThat(input.primaryFuelPrice()).isEqualTo(1.8);
		assertThat(input.hasSecondaryFuel()).isFalse();
	}

	@Test
	void electricIsDetectedFromListingLabel() {
		VehicleFacts facts = new VehicleFacts(400_000, "bensin", "Elbil", 1.6, null, null, null, null,
				null, null, null, null, null);

		NormalizedComputationInput input = assembler.assemble(facts, null);

		assertThat(input.fuelType()).isEqualTo(FuelType.ELECTRIC);
		assertThat(input.primaryFuelPrice()).isEqualTo(2.5);
	}

	@Test
	void plugInHybridCarriesElectricShare() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setSecondaryFuelShare(70.0);

		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(350_000, "laddhybrid"), config);

		assertThat(input.fuelType()).isEqualTo(FuelType.PLUG_IN_HYBRID);
		assertThat(input.primaryFuelPrice()).isEqualTo(18.5);
		assertThat(input.secondaryFuel())
				.isEqualTo(new NormalizedComputationInput.SecondaryFuel(FuelType.ELECTRIC, 2.5, 70));
	}

	@Test
	void plugInHybridWithoutShareUsesDefaultShare() {
		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(350_000, "laddhybrid"), null);

		assertThat(input.secondaryFuelShare()).isEqualTo(50);
	}

	@Test
	void blendShareIsIgnoredForSingleFuelVehicles() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setSecondaryFuelShare(80.0);

		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(350_000, "hybrid"), config);

		assertThat(input.fuelType()).isEqualTo(FuelType.HYBRID);
		assertThat(input.hasSecondaryFuel()).isFalse();
		assertThat(input.secondaryFuelShare()).isZero();
	}

	@Test
	void vehicleAgeIsDerivedFromModelYearAndNeverNegative() {
		assertThat(assembler.assemble(facts("bensin", null, 2020, null, null, null), null).vehicleAge()).isEqualTo(6);
		assertThat(assembler.assemble(facts("bensin", null, 2026, null, null, null), null).vehicleAge()).isZero();
		assertThat(assembler.assemble(facts("bensin", null, 2027, null, null, null), null).vehicleAge()).isZero();
	}

	@Test
	void missingConsumptionIsEstimatedFromFuelType() {
		NormalizedComputationInput estimated = assembler.assemble(VehicleFacts.of(300_000, "diesel"), null);
		NormalizedComputationInput measured = assembler.assemble(facts("diesel", 0.52, null, null, null, null), null);

		assertThat(estimated.fuelConsumption()).isEqualTo(0.6);
		assertThat(estimated.consumptionEstimated()).isTrue();
		assertThat(measured.fuelConsumption()).isEqualTo(0.52);
		assertThat(measured.consumptionEstimated()).isFalse();
	}

	@Test
	void userVehicleSizeWinsOverListing() {
		VehicleFacts facts = new VehicleFacts(300_000, "bensin", null, null, null, null, null, null,
				VehicleSize.SIMPLE, null, null, null, null);
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setVehicleSize(VehicleSize.LARGE);

		assertThat(assembler.assemble(facts, null).vehicleSize()).isEqualTo(VehicleSize.SIMPLE);
		assertThat(assembler.assemble(facts, config).vehicleSize()).isEqualTo(VehicleSize.LARGE);
	}

	@Test
	void loanFallsBackToDefaultTerms() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setFinancingType(FinancingType.LOAN);

		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(300_000, "bensin"), config);

		assertThat(input.financing()).isEqualTo(new FinancingPlan.Loan(LoanType.RESIDUAL, 20, 50, 5.0, 3, 60));
	}

	@Test
	void listingInterestRateOverridesConfiguredRate() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setFinancingType(FinancingType.LOAN);
		config.setInterestRate(6.0);

		FinancingPlan withListingRate = assembler.assemble(facts("bensin", null, null, null, 3.95, null), config).financing();
		FinancingPlan withZeroRate = assembler.assemble(facts("bensin", null, null, null, 0.0, null), config).financing();

		assertThat(((FinancingPlan.Loan) withListingRate).interestRate()).isEqualTo(3.95);
		assertThat(((FinancingPlan.Loan) withZeroRate).interestRate()).isEqualTo(6.0);
	}

	@Test
	void leasingFallsBackToDefaultTerms() {
		OwnershipConfiguration config = new OwnershipConfiguration();
		config.setFinancingType(FinancingType.LEASING);
		config.setLeasingIncludesInsurance(true);

		NormalizedComputationInput input = assembler.assemble(VehicleFacts.of(300_000, "bensin"), config);

		assertThat(input.financing()).isEqualTo(new FinancingPlan.Leasing(LeasingType.PRIVATE, 3500, true));
	}

	@Test
	void malusIsEstimatedForNewHighEmissionCars() {
		NormalizedComputationInput input = assembler.assemble(facts("bensin", null, 2025, 135, null, null), null);

		assertThat(input.hasMalusTax()).isTrue();
		assertThat(input.malusTaxAmount()).isEqualTo(6420);
	}

	@Test
	void malusIsNotEstimatedOutsideMalusPeriod() {
		NormalizedComputationInput input = assembler.assemble(facts("bensin", null, 2022, 180, null, null), null);

		assertThat(input.hasMalusTax()).isFalse();
		assertThat(input.malusTaxAmount()).isZero();
	}

	@Test
	void detectedMalusReplacesStoredDefaults() {
		OwnershipConfiguration stored = new OwnershipConfiguration();
		stored.setHasMalusTax(false);
		stored.setMalusTaxAmount(0.0);

		NormalizedComputationInput input = assembler.assemble(facts("bensin", null, 2025, 135, null, null), stored);

		assertThat(input.hasMalusTax()).isTrue();
		assertThat(input.malusTaxAmount()).isEqualTo(6420);
	}

	@Test
	void userMalusAmountIsKept() {
		OwnershipConfiguration custom = new OwnershipConfiguration();
		custom.setHasMalusTax(true);
		custom.setMalusTaxAmount(1234.0);

		NormalizedComputationInput input = assembler.assemble(facts("bensin", null, 2025, 135, null, null), custom);

		assertThat(input.hasMalusTax()).isTrue();
		assertThat(input.malusTaxAmount()).isEqualTo(1234);
	}

	@Test
	void storedMalusAppliesWhenNothingIsDetected() {
		OwnershipConfiguration custom = new OwnershipConfiguration();
		custom.setHasMalusTax(true);
		custom.setMalusTaxAmount(2500.0);

		NormalizedComputationInput input = assembler.assemble(facts("bensin", null, 2020, 180, null, null), custom);

		assertThat(input.hasMalusTax()).isTrue();
		assertThat(input.malusTaxAmount()).isEqualTo(2500);
	}

	private static VehicleFacts facts(String fuelType,
									  Double consumption,
									  Integer modelYear,
									  Integer co2,
									  Double effectiveInterestRate,
									  Double annualTax) {
		return new VehicleFacts(300_000, fuelType, null, consumption, modelYear, null, null, co2,
				null, null, effectiveInterestRate, annualTax, null);
	}
}
