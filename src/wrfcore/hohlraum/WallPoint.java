package wrfcore.hohlraum;

import wrfcore.physics.WallMaterial;

/**
 * Точка контура слоя стенки хольраума.
 *
 * @param layer    номер контура (0, 1, 2, ...); контуры 2k и 2k+1 - внутренняя и внешняя граница одного слоя
 * @param material материал слоя
 * @param r        радиус, см
 * @param z        координата по оси, см
 */
public record WallPoint(int layer, WallMaterial material, double r, double z) {
}
