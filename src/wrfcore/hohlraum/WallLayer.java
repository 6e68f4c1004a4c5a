package wrfcore.hohlraum;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import wrfcore.physics.WallMaterial;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Один контур стенки: ломаная r(z), отсортированная по z.
 */
public final class WallLayer {

    private final int index;
    private final WallMaterial material;
    private final double[] r;
    private final double[] z;

    /** null, если в контуре меньше двух различных z */
    private final PolynomialSplineFunction rOfZ;

    public WallLayer(int index, WallMaterial material, List<WallPoint> points) {
        this.index = index;
        this.material = material;

        WallPoint[] sorted = points.toArray(new WallPoint[0]);
        Arrays.sort(sorted, Comparator.comparingDouble(WallPoint::z));

        // точки с повторяющимся z отбрасываются (интерполяции нужны строго возрастающие узлы)
        double[] rr = new double[sorted.length];
        double[] zz = new double[sorted.length];
        int n = 0;
        for (WallPoint p : sorted) {
            if (n > 0 && p.z() <= zz[n - 1]) continue;
            rr[n] = p.r();
            zz[n] = p.z();
            n++;
        }
        this.r = Arrays.copyOf(rr, n);
        this.z = Arrays.copyOf(zz, n);
        this.rOfZ = (n >= 2) ? new LinearInterpolator().interpolate(this.z, this.r) : null;
    }

    public int getIndex() { return index; }
    public WallMaterial getMaterial() { return material; }

    public boolean isUsable() {
        return rOfZ != null;
    }

    public double minZ() { return z[0]; }
    public double maxZ() { return z[z.length - 1]; }

    /** r на контуре при заданном z (z в пределах контура). */
    public double radiusAt(double zz) {
        return rOfZ.value(zz);
    }
}
