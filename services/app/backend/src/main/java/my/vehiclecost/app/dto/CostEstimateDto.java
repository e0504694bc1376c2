package my.vehiclecost.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import my.vehiclecost.app.model.CostBreakdown;

public record CostEstimateDto(
		CostAssumptionsDto assumptions,
		@Schema(description = "Annual costs per category in whole currency units")
		CostBreakdown breakdown
) {
}
