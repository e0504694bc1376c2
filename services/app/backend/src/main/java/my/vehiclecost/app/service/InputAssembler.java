package my.vehiclecost.app.service;

import my.vehiclecost.app.config.CostDefaults;
import my.vehiclecost.app.model.CostTables;
import my.vehiclecost.app.model.FinancingPlan;
import my.vehiclecost.app.model.FinancingType;
import my.vehiclecost.app.model.FuelType;
import my.vehiclecost.app.model.NormalizedComputationInput;
import my.vehiclecost.app.model.OwnershipConfiguration;
import my.vehiclecost.app.model.TaxSource;
import my.vehiclecost.app.model.VehicleFacts;
import my.vehiclecost.app.model.VehicleSize;
import my.vehiclecost.app.service.util.FuelTypeResolver;
import my.vehiclecost.app.service.util.MalusTaxEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;

/**
 * Merges listing facts with the user's ownership settings into a fully resolved calculator input.
 * Every setting the user left unset is taken from {@link CostDefaults}.
 */
@Service
public class InputAssembler {
	private static final Logger logger = LoggerFactory.getLogger(InputAssembler.class);

	private final CostTables tables;
	private final CostDefaults defaults;
	private final Clock clock;

	public InputAssembler(CostTables tables, CostDefaults defaults, Clock clock) {
		this.tables = tables;
		this.defaults = defaults;
		this.clock = clock;
	}

	public NormalizedComputationInput assemble(VehicleFacts facts, OwnershipConfiguration configuration) {
		if (facts == null) {
			throw new IllegalArgumentException("Vehicle facts are required");
		}
		OwnershipConfiguration config = configuration == null ? new OwnershipConfiguration() : configuration;
		int currentYear = Year.now(clock).getValue();

		FuelType fuelType = FuelTypeResolver.resolve(facts.fuelType(), facts.fuelTypeLabel());
		boolean consumptionEstimated = facts.fuelConsumption() == null;
		double consumption = consumptionEstimated
				? tables.estimatedConsumption(fuelType)
				: facts.fuelConsumption();
		if (consumptionEstimated) {
			logger.debug("No measured consumption for fuel '{}', estimating {} per mil as {}.",
					facts.fuelType(), consumption, fuelType);
		}

		double primaryPrice = orDefault(config.getPrimaryFuelPrice(), defaults.primaryFuelPrice());
		double secondaryPrice = orDefault(config.getSecondaryFuelPrice(), defaults.secondaryFuelPrice());
		NormalizedComputationInput.SecondaryFuel secondaryFuel = null;
		if (fuelType == FuelType.ELECTRIC) {
			primaryPrice = secondaryPrice;
		} else if (fuelType == FuelType.PLUG_IN_HYBRID) {
			secondaryFuel = new NormalizedComputationInput.SecondaryFuel(FuelType.ELECTRIC, secondaryPrice,
					orDefault(config.getSecondaryFuelShare(), defaults.secondaryFuelShare()));
		}

		Integer vehicleAge = facts.modelYear() == null ? null : Math.max(0, currentYear - facts.modelYear());
		TaxResolution tax = resolveTax(facts, config, fuelType);
		MalusResolution malus = resolveMalus(facts, config, currentYear);

		return new NormalizedComputationInput(
				facts.purchasePrice(),
				fuelType,
				consumption,
				consumptionEstimated,
				primaryPrice,
				secondaryFuel,
				orDefault(config.getAnnualMileage(), defaults.annualMileage()),
				resolveVehicleSize(facts, config),
				config.getMaintenanceLevel() == null ? defaults.maintenanceLevel() : config.getMaintenanceLevel(),
				config.getDepreciationLevel() == null ? defaults.depreciationLevel() : config.getDepreciationLevel(),
				vehicleAge,
				config.getOwnershipYears() == null ? defaults.ownershipYears() : config.getOwnershipYears(),
				orDefault(config.getInsurance(), defaults.insurance()),
				orDefault(config.getParking(), defaults.parking()),
				orDefault(config.getAncillaryCare(), defaults.ancillaryCare()),
				resolveFinancing(facts, config),
				tax.amount(),
				tax.source(),
				malus.applies(),
				malus.amount(),
				config.getAnnualTireCost()
		);
	}

	/**
	 * Listing tax wins; then a user value that differs from the system default; then the fuel table.
	 */
	TaxResolution resolveTax(VehicleFacts facts, OwnershipConfiguration config, FuelType fuelType) {
		if (facts.annualTax() != null && facts.annualTax() > 0) {
			return new TaxResolution(facts.annualTax(), TaxSource.LISTING);
		}
		Double userTax = config.getAnnualTax();
		if (userTax != null && userTax != defaults.annualTax()) {
			return new TaxResolution(userTax, TaxSource.USER);
		}
		return new TaxResolution(tables.defaultTax(fuelType), TaxSource.FUEL_DEFAULT);
	}

	/**
	 * A malus detected from model year and emissions replaces the stored setting, unless the user
	 * entered their own malus amount. Without a detected malus the stored setting applies.
	 */
	MalusResolution resolveMalus(VehicleFacts facts, OwnershipConfiguration config, int currentYear) {
		boolean applies = config.getHasMalusTax() == null ? defaults.hasMalusTax() : config.getHasMalusTax();
		double amount = orDefault(config.getMalusTaxAmount(), defaults.malusTaxAmount());
		long estimated = MalusTaxEstimator.estimate(tables.malus(), facts.modelYear(), facts.co2Emissions(), currentYear);
		if (estimated > 0 && !(applies && amount > 0)) {
			logger.debug("Estimated malus tax {} per year (co2={} g/km, modelYear={}).",
					estimated, facts.co2Emissions(), facts.modelYear());
			return new MalusResolution(true, estimated);
		}
		return new MalusResolution(applies, amount);
	}

	FinancingPlan resolveFinancing(VehicleFacts facts, OwnershipConfiguration config) {
		FinancingType type = config.getFinancingType() == null ? defaults.financingType() : config.getFinancingType();
		if (type == FinancingType.LEASING) {
			return new FinancingPlan.Leasing(
					config.getLeasingType() == null ? defaults.leasingType() : config.getLeasingType(),
					orDefault(config.getMonthlyLeasingFee(), defaults.monthlyLeasingFee()),
					config.getLeasingIncludesInsurance() == null
							? defaults.leasingIncludesInsurance()
							: config.getLeasingIncludesInsurance());
		}
		if (type == FinancingType.LOAN) {
			double interestRate = orDefault(config.getInterestRate(), defaults.interestRate());
			if (facts.effectiveInterestRate() != null && facts.effectiveInterestRate() > 0) {
				interestRate = facts.effectiveInterestRate();
			}
			return new FinancingPlan.Loan(
					config.getLoanType() == null ? defaults.loanType() : config.getLoanType(),
					orDefault(config.getDownPaymentPercent(), defaults.downPaymentPercent()),
					orDefault(config.getResidualValuePercent(), defaults.residualValuePercent()),
					interestRate,
					config.getLoanYears() == null ? defaults.loanYears() : config.getLoanYears(),
					orDefault(config.getMonthlyAdminFee(), defaults.monthlyAdminFee()));
		}
		return new FinancingPlan.Cash();
	}

	private VehicleSize resolveVehicleSize(VehicleFacts facts, OwnershipConfiguration config) {
		if (config.getVehicleSize() != null) {
			return config.getVehicleSize();
		}
		return facts.vehicleSize() == null ? defaults.vehicleSize() : facts.vehicleSize();
	}

	private static double orDefault(Double value, double fallback) {
		return value == null ? fallback : value;
	}

	record TaxResolution(double amount, TaxSource source) {
	}

	record MalusResolution(boolean applies, double amount) {
	}
}
