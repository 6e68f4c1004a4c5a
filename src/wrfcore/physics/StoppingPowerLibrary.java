package wrfcore.physics;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Набор тормозных способностей материалов стенки хольраума (Al, DU, Au).
 * Создаётся один раз при старте и дальше передаётся по ссылке, не изменяется.
 */
public final class StoppingPowerLibrary {

    private final StoppingPower aluminum;
    private final StoppingPower uranium;
    private final StoppingPower gold;

    public StoppingPowerLibrary(StoppingPower aluminum, StoppingPower uranium, StoppingPower gold) {
        this.aluminum = Objects.requireNonNull(aluminum, "aluminum");
        this.uranium = Objects.requireNonNull(uranium, "uranium");
        this.gold = Objects.requireNonNull(gold, "gold");
    }

    /** Формула Бете для всех трёх материалов. */
    public static StoppingPowerLibrary coldMatter() {
        return new StoppingPowerLibrary(
                ColdMatterStoppingPower.aluminum(),
                ColdMatterStoppingPower.depletedUranium(),
                ColdMatterStoppingPower.gold()
        );
    }

    /** Таблицы из файлов (формат см. {@link TabulatedStoppingPower}). */
    public static StoppingPowerLibrary fromTables(Path aluminum, Path uranium, Path gold) throws IOException {
        return new StoppingPowerLibrary(
                TabulatedStoppingPower.load("Al", aluminum),
                TabulatedStoppingPower.load("DU", uranium),
                TabulatedStoppingPower.load("Au", gold)
        );
    }

    public StoppingPower getAluminum() { return aluminum; }
    public StoppingPower getUranium() { return uranium; }
    public StoppingPower getGold() { return gold; }

    public StoppingPower get(WallMaterial material) {
        return switch (material) {
            case AL -> aluminum;
            case DU -> uranium;
            case AU -> gold;
        };
    }
}
