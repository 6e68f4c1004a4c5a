package wrfcore.config;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builder для ShellModelParameters.
 */
public class ShellModelParametersBuilder {
    private String shellMaterial;
    private double ri;
    private double ro;
    private double fD;
    private double f3He;
    private double p0;
    private double teGas;
    private double teShell;
    private double teAbl;
    private double teMix;
    private double rhoAblMax;
    private double rhoAblMin;
    private double rhoAblScale;
    private double mixF;
    private double tShell;
    private double mRem;
    private double e0;
    private DedxModel dedxModel;

    private final EnumMap<ShellParamId, Double> uncertainties = new EnumMap<>(ShellParamId.class);

    public ShellModelParametersBuilder() {
    }

    /**
     * Создать builder на основе уже существующих параметров.
     */
    public static ShellModelParametersBuilder from(ShellModelParameters base) {
        ShellModelParametersBuilder b = new ShellModelParametersBuilder();
        b.shellMaterial = base.getShellMaterial();
        b.ri = base.getRi();
        b.ro = base.getRo();
        b.fD = base.getFD();
        b.f3He = base.getF3He();
        b.p0 = base.getP0();
        b.teGas = base.getTeGas();
        b.teShell = base.getTeShell();
        b.teAbl = base.getTeAbl();
        b.teMix = base.getTeMix();
        b.rhoAblMax = base.getRhoAblMax();
        b.rhoAblMin = base.getRhoAblMin();
        b.rhoAblScale = base.getRhoAblScale();
        b.mixF = base.getMixF();
        b.tShell = base.getTShell();
        b.mRem = base.getMRem();
        b.e0 = base.getE0();
        b.dedxModel = base.getDedxModel();
        b.uncertainties.putAll(base.getUncertainties());
        return b;
    }

    public ShellModelParameters build() {
        return new ShellModelParameters(
                shellMaterial,
                ri,
                ro,
                fD,
                f3He,
                p0,
                teGas,
                teShell,
                teAbl,
                teMix,
                rhoAblMax,
                rhoAblMin,
                rhoAblScale,
                mixF,
                tShell,
                mRem,
                e0,
                dedxModel,
                uncertainties
        );
    }

    /**
     * Установить 1σ погрешность параметра.
     */
    public ShellModelParametersBuilder setUncertainty(ShellParamId id, double sigma) {
        this.uncertainties.put(id, sigma);
        return this;
    }

    public Map<ShellParamId, Double> getUncertainties() {
        return uncertainties;
    }

    // --------- геттеры/сеттеры ---------

    public String getShellMaterial() {
        return shellMaterial;
    }

    public ShellModelParametersBuilder setShellMaterial(String shellMaterial) {
        this.shellMaterial = shellMaterial;
        return this;
    }

    public double getRi() {
        return ri;
    }

    public ShellModelParametersBuilder setRi(double ri) {
        this.ri = ri;
        return this;
    }

    public double getRo() {
        return ro;
    }

    public ShellModelParametersBuilder setRo(double ro) {
        this.ro = ro;
        return this;
    }

    public double getFD() {
        return fD;
    }

    public ShellModelParametersBuilder setFD(double fD) {
        this.fD = fD;
        return this;
    }

    public double getF3He() {
        return f3He;
    }

    public ShellModelParametersBuilder setF3He(double f3He) {
        this.f3He = f3He;
        return this;
    }

    public double getP0() {
        return p0;
    }

    public ShellModelParametersBuilder setP0(double p0) {
        this.p0 = p0;
        return this;
    }

    public double getTeGas() {
        return teGas;
    }

    public ShellModelParametersBuilder setTeGas(double teGas) {
        this.teGas = teGas;
        return this;
    }

    public double getTeShell() {
        return teShell;
    }

    public ShellModelParametersBuilder setTeShell(double teShell) {
        this.teShell = teShell;
        return this;
    }

    public double getTeAbl() {
        return teAbl;
    }

    public ShellModelParametersBuilder setTeAbl(double teAbl) {
        this.teAbl = teAbl;
        return this;
    }

    public double getTeMix() {
        return teMix;
    }

    public ShellModelParametersBuilder setTeMix(double teMix) {
        this.teMix = teMix;
        return this;
    }

    public double getRhoAblMax() {
        return rhoAblMax;
    }

    public ShellModelParametersBuilder setRhoAblMax(double rhoAblMax) {
        this.rhoAblMax = rhoAblMax;
        return this;
    }

    public double getRhoAblMin() {
        return rhoAblMin;
    }

    public ShellModelParametersBuilder setRhoAblMin(double rhoAblMin) {
        this.rhoAblMin = rhoAblMin;
        return this;
    }

    public double getRhoAblScale() {
        return rhoAblScale;
    }

    public ShellModelParametersBuilder setRhoAblScale(double rhoAblScale) {
        this.rhoAblScale = rhoAblScale;
        return this;
    }

    public double getMixF() {
        return mixF;
    }

    public ShellModelParametersBuilder setMixF(double mixF) {
        this.mixF = mixF;
        return this;
    }

    public double getTShell() {
        return tShell;
    }

    public ShellModelParametersBuilder setTShell(double tShell) {
        this.tShell = tShell;
        return this;
    }

    public double getMRem() {
        return mRem;
    }

    public ShellModelParametersBuilder setMRem(double mRem) {
        this.mRem = mRem;
        return this;
    }

    public double getE0() {
        return e0;
    }

    public ShellModelParametersBuilder setE0(double e0) {
        this.e0 = e0;
        return this;
    }

    public DedxModel getDedxModel() {
        return dedxModel;
    }

    public ShellModelParametersBuilder setDedxModel(DedxModel dedxModel) {
        this.dedxModel = dedxModel;
        return this;
    }
}
