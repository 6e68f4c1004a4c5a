package wrfcore.config;

/**
 * Варьируемый параметр модели оболочки: имя для отчёта, 1σ по умолчанию и способ применения.
 */
public final class ShellParameter {

    private final ShellParamId id;
    private final String name;
    private final double defaultUncertainty;
    private final ShellParamApplier applier;

    public ShellParameter(ShellParamId id,
                          String name,
                          double defaultUncertainty,
                          ShellParamApplier applier) {
        if (defaultUncertainty < 0) throw new IllegalArgumentException("uncertainty < 0 for " + id);
        this.id = id;
        this.name = name;
        this.defaultUncertainty = defaultUncertainty;
        this.applier = applier;
    }

    public ShellParamId getId() { return id; }
    public String getName() { return name; }
    public double getDefaultUncertainty() { return defaultUncertainty; }
    public ShellParamApplier getApplier() { return applier; }

    /**
     * Копия параметров, в которой этот параметр сдвинут на delta от номинала.
     *
     * @throws IllegalArgumentException если сдвинутое значение недопустимо
     */
    public ShellModelParameters shifted(ShellModelParameters base, double delta) {
        // копия через builder.from(base) -> применяем параметр -> build
        ShellModelParametersBuilder b = ShellModelParametersBuilder.from(base);
        applier.apply(b, base.value(id) + delta);
        return b.build();
    }
}
