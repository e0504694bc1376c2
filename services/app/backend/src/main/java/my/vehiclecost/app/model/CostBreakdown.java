package my.vehiclecost.app.model;

/**
 * Annual cost per category in whole currency units. {@code financing} is always
 * {@code monthlyLoanPayment * 12}; {@code costPerKm} is a two-decimal display string.
 */
public record CostBreakdown(long fuel,
							long depreciation,
							long tax,
							long maintenance,
							long tires,
							long insurance,
							long parking,
							long ancillaryCare,
							long financing,
							long monthlyLoanPayment,
							long variableCosts,
							long fixedCosts,
							long totalAnnual,
							long costPerMil,
							String costPerKm,
							long monthlyTotal) {
}
