package my.vehiclecost.app.service.util;

import my.vehiclecost.app.model.FuelType;

import java.util.Locale;
import java.util.Set;

public final class FuelTypeResolver {
	private static final Set<String> ELECTRIC_KEYS = Set.of("el", "electric", "elbil");
	private static final Set<String> ELECTRIC_LABELS = Set.of("el", "100% el");

	private FuelTypeResolver() {
	}

	/**
	 * Maps a free-text fuel value to a fuel type by case-insensitive substring match against the
	 * synonyms of each type, in declaration order. Blank or unknown values resolve to gasoline.
	 */
	public static FuelType normalize(String fuelType) {
		String value = lower(fuelType);
		if (value.isEmpty()) {
			return FuelType.GASOLINE;
		}
		for (FuelType candidate : FuelType.values()) {
			for (String synonym : candidate.getSynonyms()) {
				if (value.contains(synonym)) {
					return candidate;
				}
			}
		}
		return FuelType.GASOLINE;
	}

	/**
	 * Whether a listing describes a fully electric vehicle. The label is the text shown on the listing
	 * and may be more specific than the fuel value, e.g. "Tesla Elbil Premium".
	 */
	public static boolean isElectric(String fuelType, String fuelTypeLabel) {
		String value = lower(fuelType);
		String label = lower(fuelTypeLabel);
		return ELECTRIC_KEYS.contains(value)
				|| label.contains("elbil")
				|| ELECTRIC_LABELS.contains(label);
	}

	public static FuelType resolve(String fuelType, String fuelTypeLabel) {
		if (isElectric(fuelType, fuelTypeLabel)) {
			return FuelType.ELECTRIC;
		}
		return normalize(fuelType);
	}

	private static String lower(String value) {
		return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
	}
}
