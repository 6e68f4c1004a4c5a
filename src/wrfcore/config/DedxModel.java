package wrfcore.config;

/**
 * Модель тормозной способности плазмы в модели rhoR.
 */
public enum DedxModel {
    LI_PETRASSO
}
