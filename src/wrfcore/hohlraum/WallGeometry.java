package wrfcore.hohlraum;

import java.util.*;

/**
 * Геометрия стенки хольраума: набор контуров, сгруппированных по номеру.
 * Контуры идут парами (внутренняя и внешняя граница слоя), материал слоя берётся по первой точке контура.
 */
public final class WallGeometry {

    private final List<WallLayer> layers;

    public WallGeometry(List<WallPoint> points) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) throw new IllegalArgumentException("wall geometry has no points");

        int maxIndex = 0;
        for (WallPoint p : points) {
            if (p.layer() < 0) throw new IllegalArgumentException("negative layer index: " + p.layer());
            maxIndex = Math.max(maxIndex, p.layer());
        }

        List<List<WallPoint>> grouped = new ArrayList<>();
        for (int i = 0; i <= maxIndex; i++) grouped.add(new ArrayList<>());
        for (WallPoint p : points) grouped.get(p.layer()).add(p);

        List<WallLayer> list = new ArrayList<>();
        for (int i = 0; i <= maxIndex; i++) {
            List<WallPoint> g = grouped.get(i);
            if (g.isEmpty()) throw new IllegalArgumentException("layer " + i + " has no points");
            list.add(new WallLayer(i, g.get(0).material(), g));
        }
        this.layers = Collections.unmodifiableList(list);
    }

    public List<WallLayer> getLayers() {
        return layers;
    }

    public int layerCount() {
        return layers.size();
    }

    /** Число полных пар контуров. */
    public int pairCount() {
        return layers.size() / 2;
    }

    public boolean hasEvenLayerCount() {
        return layers.size() % 2 == 0;
    }
}
