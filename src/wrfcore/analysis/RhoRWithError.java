package wrfcore.analysis;

/**
 * ρR (г/см²), Rcm (см) и полная погрешность ρR (модель и, при dE > 0, энергия в квадратуре).
 */
public record RhoRWithError(double rhoR, double rcm, double error, ErrorBudget modelBudget) {
}
