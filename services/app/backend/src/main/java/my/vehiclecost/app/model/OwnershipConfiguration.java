package my.vehiclecost.app.model;

/**
 * A user's ownership settings. Every field is optional; unset fields fall back to the configured
 * defaults when the input is assembled. Monthly amounts: insurance, parking, ancillary care, fees.
 */
public class OwnershipConfiguration {
	private Double annualMileage;
	private Double primaryFuelPrice;
	private Double secondaryFuelPrice;
	private Double secondaryFuelShare;
	private VehicleSize vehicleSize;
	private MaintenanceLevel maintenanceLevel;
	private DepreciationLevel depreciationLevel;
	private Integer ownershipYears;
	private Double insurance;
	private Double parking;
	private Double ancillaryCare;
	private FinancingType financingType;
	private LoanType loanType;
	private Double downPaymentPercent;
	private Double residualValuePercent;
	private Double interestRate;
	private Integer loanYears;
	private Double monthlyAdminFee;
	private LeasingType leasingType;
	private Double monthlyLeasingFee;
	private Boolean leasingIncludesInsurance;
	private Double annualTax;
	private Boolean hasMalusTax;
	private Double malusTaxAmount;
	private Double annualTireCost;

	public Double getAnnualMileage() {
		return annualMileage;
	}

	public void setAnnualMileage(Double annualMileage) {
		this.annualMileage = annualMileage;
	}

	public Double getPrimaryFuelPrice() {
		return primaryFuelPrice;
	}

	public void setPrimaryFuelPrice(Double primaryFuelPrice) {
		this.primaryFuelPrice = primaryFuelPrice;
	}

	public Double getSecondaryFuelPrice() {
		return secondaryFuelPrice;
	}

	public void setSecondaryFuelPrice(Double secondaryFuelPrice) {
		this.secondaryFuelPrice = secondaryFuelPrice;
	}

	public Double getSecondaryFuelShare() {
		return secondaryFuelShare;
	}

	public void setSecondaryFuelShare(Double secondaryFuelShare) {
		this.secondaryFuelShare = secondaryFuelShare;
	}

	public VehicleSize getVehicleSize() {
		return vehicleSize;
	}

	public void setVehicleSize(VehicleSize vehicleSize) {
		this.vehicleSize = vehicleSize;
	}

	public MaintenanceLevel getMaintenanceLevel() {
		return maintenanceLevel;
	}

	public void setMaintenanceLevel(MaintenanceLevel maintenanceLevel) {
		this.maintenanceLevel = maintenanceLevel;
	}

	public DepreciationLevel getDepreciationLevel() {
		return depreciationLevel;
	}

	public void setDepreciationLevel(DepreciationLevel depreciationLevel) {
		this.depreciationLevel = depreciationLevel;
	}

	public Integer getOwnershipYears() {
		return ownershipYears;
	}

	public void setOwnershipYears(Integer ownershipYears) {
		this.ownershipYears = ownershipYears;
	}

	public Double getInsurance() {
		return insurance;
	}

	public void setInsurance(Double insurance) {
		this.insurance = insurance;
	}

	public Double getParking() {
		return parking;
	}

	public void setParking(Double parking) {
		this.parking = parking;
	}

	public Double getAncillaryCare() {
		return ancillaryCare;
	}

	public void setAncillaryCare(Double ancillaryCare) {
		this.ancillaryCare = ancillaryCare;
	}

	public FinancingType getFinancingType() {
		return financingType;
	}

	public void setFinancingType(FinancingType financingType) {
		this.financingType = financingType;
	}

	public LoanType getLoanType() {
		return loanType;
	}

	public void setLoanType(LoanType loanType) {
		this.loanType = loanType;
	}

	public Double getDownPaymentPercent() {
		return downPaymentPercent;
	}

	public void setDownPaymentPercent(Double downPaymentPercent) {
		this.downPaymentPercent = downPaymentPercent;
	}

	public Double getResidualValuePercent() {
		return residualValuePercent;
	}

	public void setResidualValuePercent(Double residualValuePercent) {
		this.residualValuePercent = residualValuePercent;
	}

	public Double getInterestRate() {
		return interestRate;
	}

	public void setInterestRate(Double interestRate) {
		this.interestRate = interestRate;
	}

	public Integer getLoanYears() {
		return loanYears;
	}

	public void setLoanYears(Integer loanYears) {
		this.loanYears = loanYears;
	}

	public Double getMonthlyAdminFee() {
		return monthlyAdminFee;
	}

	public void setMonthlyAdminFee(Double monthlyAdminFee) {
		this.monthlyAdminFee = monthlyAdminFee;
	}

	public LeasingType getLeasingType() {
		return leasingType;
	}

	public void setLeasingType(LeasingType leasingType) {
		this.leasingType = leasingType;
	}

	public Double getMonthlyLeasingFee() {
		return monthlyLeasingFee;
	}

	public void setMonthlyLeasingFee(Double monthlyLeasingFee) {
		this.monthlyLeasingFee = monthlyLeasingFee;
	}

	public Boolean getLeasingIncludesInsurance() {
		return leasingIncludesInsurance;
	}

	public void setLeasingIncludesInsurance(Boolean leasingIncludesInsurance) {
		this.leasingIncludesInsurance = leasingIncludesInsurance;
	}

	public Double getAnnualTax() {
		return annualTax;
	}

	public void setAnnualTax(Double annualTax) {
		this.annualTax = annualTax;
	}

	public Boolean getHasMalusTax() {
		return hasMalusTax;
	}

	public void setHasMalusTax(Boolean hasMalusTax) {
		this.hasMalusTax = hasMalusTax;
	}

	public Double getMalusTaxAmount() {
		return malusTaxAmount;
	}

	public void setMalusTaxAmount(Double malusTaxAmount) {
		this.malusTaxAmount = malusTaxAmount;
	}

	public Double getAnnualTireCost() {
		return annualTireCost;
	}

	public void setAnnualTireCost(Double annualTireCost) {
		this.annualTireCost = annualTireCost;
	}
}
