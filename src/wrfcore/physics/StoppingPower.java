package wrfcore.physics;

/**
 * Тормозная способность вещества (или плазмы) для протона.
 * Реализации неизменяемы и могут разделяться между потоками только на чтение.
 */
public interface StoppingPower {

    /**
     * @param energyMeV энергия протона, МэВ
     * @return dE/dx, МэВ/мкм (отрицательное значение означает потерю энергии)
     */
    double dEdx(double energyMeV);

    /**
     * Энергия на выходе из слоя.
     *
     * @param energyMeV   энергия на входе, МэВ
     * @param thicknessUm толщина слоя, мкм
     * @return энергия на выходе, МэВ (не меньше 0)
     */
    double eout(double energyMeV, double thicknessUm);

    /**
     * Энергия на входе в слой, при которой на выходе получается energyMeV.
     *
     * @param energyMeV   энергия на выходе, МэВ
     * @param thicknessUm толщина слоя, мкм
     * @return энергия на входе, МэВ
     */
    double ein(double energyMeV, double thicknessUm);

    /** Нижняя граница области применимости, МэВ */
    double getEmin();

    /** Верхняя граница области применимости, МэВ */
    double getEmax();
}
