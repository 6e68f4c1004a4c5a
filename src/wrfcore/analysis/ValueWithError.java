package wrfcore.analysis;

/**
 * Значение, его полная погрешность и разбивка модельной части погрешности.
 */
public record ValueWithError(double value, double error, ErrorBudget budget) {
}
