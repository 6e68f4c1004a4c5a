package wrfcore.analysis;

import wrfcore.config.ShellParamId;

/**
 * Вклад одного параметра в погрешность.
 *
 * @param error   половина разброса значений {номинал, -1σ, +1σ}; NaN, если параметр отброшен
 * @param dropped true, если хотя бы одно из трёх значений - NaN (вклад не входит в сумму)
 */
public record ErrorContribution(ShellParamId id, String name, double error, boolean dropped) {
}
