package wrfcore.hohlraum;

/**
 * Откуда взяты толщины стенки.
 */
public enum ThicknessMode {
    /** Посчитаны по геометрии стенки и диапазону LOS */
    FROM_WALL,
    /** Заданы явно (в том числе нулевые, если не задано ничего) */
    FROM_EXPLICIT_THICKNESS
}
