package wrfcore.analysis;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Погрешность модели (корень из суммы квадратов вкладов) и разбивка по параметрам.
 */
public record ErrorBudget(double total, List<ErrorContribution> contributions) {

    public static final ErrorBudget EMPTY = new ErrorBudget(0.0, List.of());

    public ErrorBudget {
        contributions = List.copyOf(contributions);
    }

    /** Число параметров, отброшенных из-за NaN. */
    public int droppedCount() {
        int n = 0;
        for (ErrorContribution c : contributions) if (c.dropped()) n++;
        return n;
    }

    /** Бюджет с пересчётом всех величин на множитель (например, г/см² -> мг/см²). */
    public ErrorBudget scaled(double factor) {
        return new ErrorBudget(total * factor, contributions.stream()
                .map(c -> new ErrorContribution(c.id(), c.name(), c.error() * factor, c.dropped()))
                .collect(Collectors.toList()));
    }
}
