package my.vehiclecost.app.model;

public enum LoanType {
	/** Balloon loan: only the part above the residual value is amortized during the term. */
	RESIDUAL,
	/** Fully amortizing loan with a constant installment. */
	ANNUITY
}
