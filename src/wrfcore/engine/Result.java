package wrfcore.engine;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Значение или ошибка (вид + сообщение). Используется там, где отказ затрагивает
 * одну величину и не должен прерывать остальной расчёт.
 */
public final class Result<T> {

    private final T value;
    private final ErrorKind error;
    private final String message;

    private Result(T value, ErrorKind error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Result<T> fail(ErrorKind error, String message) {
        return new Result<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isOk() {
        return error == null;
    }

    public T get() {
        if (error != null) throw new NoSuchElementException(error + ": " + message);
        return value;
    }

    public T orElse(T other) {
        return (error == null) ? value : other;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> f) {
        if (error != null) return fail(error, message);
        return ok(f.apply(value));
    }

    public ErrorKind getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + value + "]" : "Fail[" + error + ": " + message + "]";
    }
}
