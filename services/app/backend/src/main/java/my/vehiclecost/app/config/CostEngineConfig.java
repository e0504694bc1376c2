package my.vehiclecost.app.config;

import my.vehiclecost.app.model.CostTables;
import my.vehiclecost.app.service.AgeCurveDepreciationModel;
import my.vehiclecost.app.service.DepreciationModel;
import my.vehiclecost.app.service.FlatRateDepreciationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class CostEngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(CostEngineConfig.class);

	@Bean
	@ConditionalOnMissingBean(CostTables.class)
	public CostTables costTables() {
		return CostTables.defaults();
	}

	@Bean
	public CostDefaults costDefaults(AppProperties properties) {
		if (properties.defaults() == null) {
			return CostDefaults.standard();
		}
		return properties.defaults();
	}

	@Bean
	@ConditionalOnMissingBean(Clock.class)
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	@ConditionalOnProperty(name = "app.depreciation.model", havingValue = "flat")
	public FlatRateDepreciationModel flatRateDepreciationModel(CostTables tables) {
		logger.info("Depreciation model enabled (model=flat).");
		return new FlatRateDepreciationModel(tables);
	}

	@Bean
	@ConditionalOnMissingBean(DepreciationModel.class)
	public AgeCurveDepreciationModel ageCurveDepreciationModel(CostTables tables) {
		logger.info("Depreciation model enabled (model=age-curve).");
		return new AgeCurveDepreciationModel(tables);
	}
}
