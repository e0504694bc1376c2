package my.vehiclecost.app.service;

import my.vehiclecost.app.model.FinancingPlan;
import my.vehiclecost.app.model.LoanType;
import org.springframework.stereotype.Service;

/**
 * Monthly installment and annual cost of a financing plan. The installment is rounded to whole
 * currency units first and the annual cost is always {@code installment * 12}.
 */
@Service
public class FinancingCalculator {
	private static final int MONTHS_PER_YEAR = 12;

	public FinancingCost calculate(FinancingPlan plan, double purchasePrice) {
		if (plan instanceof FinancingPlan.Leasing leasing) {
			return FinancingCost.ofMonthly(Math.round(leasing.monthlyFee()));
		}
		if (plan instanceof FinancingPlan.Loan loan && loan.loanYears() > 0) {
			return FinancingCost.ofMonthly(Math.round(loanInstallment(loan, purchasePrice)));
		}
		return FinancingCost.NONE;
	}

	private static double loanPrincipal(FinancingPlan.Loan loan, double purchasePrice) {
		return purchasePrice - purchasePrice * (loan.downPaymentPercent() / 100);
	}

	/**
	 * Unrounded monthly installment. The admin fee is not added: quoted effective rates already cover it.
	 */
	static double loanInstallment(FinancingPlan.Loan loan, double purchasePrice) {
		double monthlyRate = loan.interestRate() / 100 / MONTHS_PER_YEAR;
		int payments = loan.loanYears() * MONTHS_PER_YEAR;
		double principal = loanPrincipal(loan, purchasePrice);
		if (loan.loanType() == LoanType.ANNUITY) {
			return annuityInstallment(principal, monthlyRate, payments);
		}
		double residual = purchasePrice * (loan.residualValuePercent() / 100);
		return residualInstallment(principal, residual, monthlyRate, payments);
	}

	/**
	 * Balloon loan: the part above the residual is amortized linearly, interest is charged on the
	 * average of opening and residual balance.
	 */
	static double residualInstallment(double principal, double residual, double monthlyRate, int payments) {
		double amortization = Math.max(0.0, principal - residual) / payments;
		double averageBalance = (principal + residual) / 2;
		return amortization + averageBalance * monthlyRate;
	}

	static double annuityInstallment(double principal, double monthlyRate, int payments) {
		if (monthlyRate == 0.0) {
			return principal / payments;
		}
		double factor = Math.pow(1 + monthlyRate, payments);
		return principal * (monthlyRate * factor) / (factor - 1);
	}

	public record FinancingCost(long monthlyPayment, long annualCost) {
		public static final FinancingCost NONE = new FinancingCost(0, 0);

		static FinancingCost ofMonthly(long monthlyPayment) {
			return new FinancingCost(monthlyPayment, monthlyPayment * MONTHS_PER_YEAR);
		}
	}
}
