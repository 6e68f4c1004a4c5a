package wrfcore.model;

/**
 * ρR (г/см²) и Rcm (см), соответствующие измеренной энергии. NaN, если энергия вне таблицы.
 */
public record RhoRSolution(double rhoR, double rcm) {

    public static final RhoRSolution NAN = new RhoRSolution(Double.NaN, Double.NaN);

    public boolean isValid() {
        return !Double.isNaN(rhoR) && !Double.isNaN(rcm);
    }
}
