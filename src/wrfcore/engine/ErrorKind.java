package wrfcore.engine;

/**
 * Виды ошибок численного ядра.
 */
public enum ErrorKind {

    /** Оптимизатор не улучшил chi2 за отведённое число вычислений */
    CONVERGENCE_FAILURE,

    /** Энергия или радиус вне области таблиц интерполяции */
    OUT_OF_RANGE_INPUT,

    /** Нечётное число слоёв стенки или луч не пересекает слой */
    INVALID_GEOMETRY,

    /** Нулевой выход в бине при поправке ширины бина */
    DIVISION_GUARD,

    /** Недопустимые значения параметров модели (например, после сдвига на 1σ) */
    INVALID_PARAMETERS
}
