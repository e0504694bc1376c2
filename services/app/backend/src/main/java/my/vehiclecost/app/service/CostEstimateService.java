package my.vehiclecost.app.service;

import my.vehiclecost.app.config.CostDefaults;
import my.vehiclecost.app.dto.CostAssumptionsDto;
import my.vehiclecost.app.dto.CostEstimateDto;
import my.vehiclecost.app.dto.CostEstimateRequest;
import my.vehiclecost.app.dto.FuelTypeDto;
import my.vehiclecost.app.model.CostBreakdown;
import my.vehiclecost.app.model.FuelType;
import my.vehiclecost.app.model.NormalizedComputationInput;
import my.vehiclecost.app.model.OwnershipConfiguration;
import my.vehiclecost.app.model.VehicleFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Service
public class CostEstimateService {
	private static final Logger logger = LoggerFactory.getLogger(CostEstimateService.class);

	private final InputAssembler inputAssembler;
	private final CostCalculator costCalculator;
	private final CostDefaults defaults;

	public CostEstimateService(InputAssembler inputAssembler, CostCalculator costCalculator, CostDefaults defaults) {
		this.inputAssembler = inputAssembler;
		this.costCalculator = costCalculator;
		this.defaults = defaults;
	}

	public CostEstimateDto estimate(CostEstimateRequest request) {
		NormalizedComputationInput input = assembleInput(request);
		CostBreakdown breakdown = costCalculator.calculate(input);
		logger.debug("Estimated {} per month for {} at {} mil/year (financing={}).",
				breakdown.monthlyTotal(), input.fuelType(), input.annualMileage(), input.financing().type());
		return new CostEstimateDto(CostAssumptionsDto.from(input), breakdown);
	}

	public CostAssumptionsDto assemble(CostEstimateRequest request) {
		return CostAssumptionsDto.from(assembleInput(request));
	}

	public List<FuelTypeDto> listFuelTypes() {
		return Arrays.stream(FuelType.values())
				.map(FuelTypeDto::from)
				.toList();
	}

	public CostDefaults getDefaults() {
		return defaults;
	}

	private NormalizedComputationInput assembleInput(CostEstimateRequest request) {
		if (request == null || request.vehicle() == null) {
			throw new IllegalArgumentException("Vehicle facts are required");
		}
		VehicleFacts facts = request.vehicle().toFacts();
		OwnershipConfiguration configuration = request.configuration() == null
				? new OwnershipConfiguration()
				: request.configuration().toConfiguration();
		return inputAssembler.assemble(facts, configuration);
	}
}
