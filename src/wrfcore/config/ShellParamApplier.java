package wrfcore.config;

@FunctionalInterface
public interface ShellParamApplier {
    void apply(ShellModelParametersBuilder b, double v);
}
