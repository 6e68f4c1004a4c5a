package wrfcore.physics;

import java.util.Locale;

/**
 * Материалы стенки хольраума.
 */
public enum WallMaterial {

    AU("Au"),
    DU("DU"),
    AL("Al");

    private final String label;

    WallMaterial(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** "Au", "DU" (или "U"), "Al" без учёта регистра. */
    public static WallMaterial parse(String s) {
        String v = s.trim().toUpperCase(Locale.ROOT);
        return switch (v) {
            case "AU" -> AU;
            case "DU", "U" -> DU;
            case "AL" -> AL;
            default -> throw new IllegalArgumentException("Unknown wall material: " + s);
        };
    }
}
