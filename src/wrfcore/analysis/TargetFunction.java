package wrfcore.analysis;

import wrfcore.model.InverseRhoRSolver;

/**
 * Величина, погрешность которой оценивается по разбросу возмущённых моделей.
 */
public enum TargetFunction {

    /** Энергия на выходе при заданном Rcm, МэВ */
    EOUT {
        @Override
        public double apply(InverseRhoRSolver s, double rcm, double e1) {
            return s.eout(rcm);
        }
    },

    /** ρR для измеренной энергии E1, г/см² */
    CALC_RHOR {
        @Override
        public double apply(InverseRhoRSolver s, double rcm, double e1) {
            return s.calcRhoR(e1).rhoR();
        }
    },

    /** Rcm для измеренной энергии E1, см */
    CALC_RHOR_RCM {
        @Override
        public double apply(InverseRhoRSolver s, double rcm, double e1) {
            return s.calcRhoR(e1).rcm();
        }
    },

    /** Полный ρR при заданном Rcm, г/см² */
    RHOR_TOTAL {
        @Override
        public double apply(InverseRhoRSolver s, double rcm, double e1) {
            return s.rhoRTotal(rcm);
        }
    };

    public abstract double apply(InverseRhoRSolver solver, double rcm, double e1);
}
