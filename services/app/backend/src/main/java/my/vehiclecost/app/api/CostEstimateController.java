package my.vehiclecost.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.vehiclecost.app.config.CostDefaults;
import my.vehiclecost.app.dto.CostAssumptionsDto;
import my.vehiclecost.app.dto.CostEstimateDto;
import my.vehiclecost.app.dto.CostEstimateRequest;
import my.vehiclecost.app.dto.FuelTypeDto;
import my.vehiclecost.app.service.CostEstimateService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/costs")
@Tag(name = "Cost Estimates")
public class CostEstimateController {
	private final CostEstimateService costEstimateService;

	public CostEstimateController(CostEstimateService costEstimateService) {
		this.costEstimateService = costEstimateService;
	}

	@PostMapping("/estimate")
	@Operation(summary = "Estimate the annual cost of owning a vehicle")
	public CostEstimateDto estimate(@Valid @RequestBody CostEstimateRequest request) {
		return costEstimateService.estimate(request);
	}

	@PostMapping("/assemble")
	@Operation(summary = "Resolve listing facts and settings without calculating costs")
	public CostAssumptionsDto assemble(@Valid @RequestBody CostEstimateRequest request) {
		return costEstimateService.assemble(request);
	}

	@GetMapping("/fuel-types")
	@Operation(summary = "List supported fuel types with units and default prices")
	public List<FuelTypeDto> fuelTypes() {
		return costEstimateService.listFuelTypes();
	}

	@GetMapping("/defaults")
	@Operation(summary = "Get the default ownership settings")
	public CostDefaults defaults() {
		return costEstimateService.getDefaults();
	}
}
