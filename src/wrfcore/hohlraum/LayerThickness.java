package wrfcore.hohlraum;

import wrfcore.physics.WallMaterial;

/**
 * Толщина одного слоя (пара контуров) вдоль LOS: среднее и выборочное СКО по углам, см.
 */
public record LayerThickness(int pair, WallMaterial material, double meanCm, double stdCm) {
}
