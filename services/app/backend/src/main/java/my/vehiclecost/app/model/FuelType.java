package my.vehiclecost.app.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum FuelType {
	GASOLINE("bensin", "Gasoline", "kr/l", 18.5, List.of("bensin", "petrol", "gasoline")),
	DIESEL("diesel", "Diesel", "kr/l", 19.5, List.of("diesel")),
	PLUG_IN_HYBRID("laddhybrid", "Plug-in hybrid", "kr/l", 18.5, List.of("laddhybrid", "plug-in", "phev")),
	HYBRID("hybrid", "Hybrid", "kr/l", 18.5, List.of("hybrid", "elhybrid")),
	ELECTRIC("el", "Electric", "kr/kWh", 2.5, List.of("el", "electric")),
	ETHANOL_BLEND("e85", "E85", "kr/l", 14.5, List.of("e85", "etanol", "ethanol")),
	BIOGAS("biogas", "Biogas", "kr/kg", 32.0, List.of("gas", "biogas", "cng"));

	private final String key;
	private final String label;
	private final String unit;
	private final double defaultPrice;
	// lower-case substrings matched against listing text, checked in declaration order
	private final List<String> synonyms;
}
