package wrfcore.physics;

import org.apache.commons.math3.ode.FirstOrderDifferentialEquations;
import org.apache.commons.math3.ode.FirstOrderIntegrator;
import org.apache.commons.math3.ode.nonstiff.ClassicalRungeKuttaIntegrator;

/**
 * Общая часть: интегрирование dE/dx по толщине слоя (RK4 с фиксированным шагом).
 */
public abstract class AbstractStoppingPower implements StoppingPower {

    /** Число шагов интегрирования на слой */
    public static final int DEFAULT_STEPS = 100;

    /** Стартовая энергия для обратного расчёта из нуля, МэВ */
    private static final double EIN_FLOOR_MEV = 1e-3;

    private final int steps;

    protected AbstractStoppingPower() {
        this(DEFAULT_STEPS);
    }

    protected AbstractStoppingPower(int steps) {
        if (steps <= 0) throw new IllegalArgumentException("steps must be > 0");
        this.steps = steps;
    }

    @Override
    public double eout(double energyMeV, double thicknessUm) {
        if (thicknessUm <= 0.0 || Double.isNaN(thicknessUm)) return energyMeV;
        if (energyMeV <= 0.0) return 0.0;

        // dE/dx < 0: энергия убывает по мере прохождения слоя
        FirstOrderDifferentialEquations ode = new EnergyLossEquation(+1.0);
        double e = integrate(ode, energyMeV, thicknessUm);
        // частица остановилась в слое
        if (e <= rangeOutEnergy()) return 0.0;
        return e;
    }

    @Override
    public double ein(double energyMeV, double thicknessUm) {
        if (thicknessUm <= 0.0 || Double.isNaN(thicknessUm)) return energyMeV;

        // идём по слою в обратную сторону
        FirstOrderDifferentialEquations ode = new EnergyLossEquation(-1.0);
        return integrate(ode, Math.max(energyMeV, EIN_FLOOR_MEV), thicknessUm);
    }

    private double integrate(FirstOrderDifferentialEquations ode, double e0, double thicknessUm) {
        FirstOrderIntegrator rk4 = new ClassicalRungeKuttaIntegrator(thicknessUm / steps);
        double[] y = new double[]{e0};
        rk4.integrate(ode, 0.0, y, thicknessUm, y);
        return y[0];
    }

    /**
     * Энергия, ниже которой частица считается остановившейся, МэВ.
     */
    protected double rangeOutEnergy() {
        return 0.0;
    }

    public int getSteps() {
        return steps;
    }

    private final class EnergyLossEquation implements FirstOrderDifferentialEquations {

        private final double direction;

        EnergyLossEquation(double direction) {
            this.direction = direction;
        }

        @Override
        public int getDimension() {
            return 1;
        }

        @Override
        public void computeDerivatives(double t, double[] y, double[] yDot) {
            double e = y[0];
            yDot[0] = (e > rangeOutEnergy()) ? direction * dEdx(e) : 0.0;
        }
    }
}
