package my.vehiclecost.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@DefaultValue CostDefaults defaults,
		@DefaultValue Depreciation depreciation
) {
	public record Depreciation(
			@NotBlank @DefaultValue("age-curve") String model
	) {
	}
}
