package my.vehiclecost.app.model;

/**
 * How the purchase is paid for. Each mode only carries the fields it needs.
 */
public sealed interface FinancingPlan permits FinancingPlan.Cash, FinancingPlan.Loan, FinancingPlan.Leasing {

	FinancingType type();

	record Cash() implements FinancingPlan {
		@Override
		public FinancingType type() {
			return FinancingType.CASH;
		}
	}

	/**
	 * Percentages and the interest rate are given in percent, e.g. {@code 5.0} for 5 %.
	 * The admin fee is informational: quoted effective rates already include it.
	 */
	record Loan(LoanType loanType,
				double downPaymentPercent,
				double residualValuePercent,
				double interestRate,
				int loanYears,
				double monthlyAdminFee) implements FinancingPlan {
		@Override
		public FinancingType type() {
			return FinancingType.LOAN;
		}
	}

	record Leasing(LeasingType leasingType,
				   double monthlyFee,
				   boolean includesInsurance) implements FinancingPlan {
		@Override
		public FinancingType type() {
			return FinancingType.LEASING;
		}
	}
}
