package wrfcore.hohlraum;

import wrfcore.spectrum.GaussFitResult;
import wrfcore.spectrum.Spectrum;

/**
 * Сырой и исправленный спектры с их фитами.
 *
 * @param guardedBins число бинов с нулевым выходом, у которых погрешность перенесена без масштабирования
 */
public record HohlraumFit(Spectrum raw,
                          Spectrum corrected,
                          GaussFitResult rawFit,
                          GaussFitResult correctedFit,
                          WallThickness thickness,
                          int guardedBins) {

    /** Сдвиг среднего: исправленный фит минус сырой, МэВ. */
    public double energyShift() {
        return correctedFit.getMean() - rawFit.getMean();
    }
}
