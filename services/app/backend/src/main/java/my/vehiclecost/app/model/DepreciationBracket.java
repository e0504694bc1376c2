package my.vehiclecost.app.model;

/**
 * Annual depreciation rate for vehicles younger than {@code maxAge} years.
 */
public record DepreciationBracket(int maxAge, double rate) {
}
