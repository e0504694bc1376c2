package my.vehiclecost.app.model;

/**
 * Where the annual vehicle tax of a computation came from.
 */
public enum TaxSource {
	LISTING,
	USER,
	FUEL_DEFAULT
}
