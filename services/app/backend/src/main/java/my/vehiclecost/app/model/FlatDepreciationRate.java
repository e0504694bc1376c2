package my.vehiclecost.app.model;

public record FlatDepreciationRate(double firstYear, double laterYears) {
}
