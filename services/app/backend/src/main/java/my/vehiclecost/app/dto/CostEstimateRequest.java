package my.vehiclecost.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CostEstimateRequest(
		@NotNull @Valid VehicleFactsRequest vehicle,
		@Valid OwnershipConfigurationRequest configuration
) {
}
