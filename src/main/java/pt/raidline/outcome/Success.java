package pt.raidline.outcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.raidline.outcome.exception.UnwrapException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * The successful variant of {@link Result}, holding {@code value}.
 *
 * @param value the success value, may be {@code null}
 * @param <V>   the type of the success value
 * @param <E>   the type of the error this result would have carried
 */
public record Success<V, E>(V value) implements Result<V, E> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Success.class);

    @Override
    public boolean isOk() {
        return true;
    }

    @Override
    public boolean isErr() {
        return false;
    }

    @Override
    public V unwrapOr(V defaultValue) {
        return value;
    }

    @Override
    public <R> Result<R, E> map(Function<? super V, ? extends R> mapper) {
        Objects.requireNonNull(mapper);

        return new Success<>(mapper.apply(value));
    }

    @Override
    public <F> Result<V, F> mapErr(Function<? super E, ? extends F> mapper) {
        Objects.requireNonNull(mapper);

        return withErrorType();
    }

    @Override
    public <R> Result<R, E> andThen(Function<? super V, ? extends Result<R, E>> mapper) {
        Objects.requireNonNull(mapper);

        return mapper.apply(value);
    }

    @Override
    public <F> Result<V, F> orElse(Function<? super E, ? extends Result<V, F>> recovery) {
        Objects.requireNonNull(recovery);

        return withErrorType();
    }

    @Override
    public <R> R match(Function<? super V, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
        Objects.requireNonNull(onOk);
        Objects.requireNonNull(onErr);

        return onOk.apply(value);
    }

    @Override
    public V unwrap() {
        return value;
    }

    @Override
    public E unwrapErr() {
        throw UnwrapException.fromUnwrapErrOnSuccess(value);
    }

    @Override
    public V unwrapUnchecked() {
        return value;
    }

    @Override
    public E unwrapErrUnchecked() {
        throw UnwrapException.fromUnwrapErrOnSuccess(value);
    }

    @Override
    public V unwrapOrElse(Function<? super E, ? extends V> fallback) {
        Objects.requireNonNull(fallback);

        return value;
    }

    @Override
    public V unwrapOrDefault(DefaultValueProvider<? extends V> provider) {
        Objects.requireNonNull(provider);

        return value;
    }

    @Override
    public Result<V, E> inspect(Consumer<? super V> action) {
        Objects.requireNonNull(action);

        try {
            action.accept(value);
        } catch (Exception ex) {
            LOGGER.debug("Ignoring exception thrown while inspecting success value", ex);
        }
        return this;
    }

    @Override
    public Result<V, E> inspectErr(Consumer<? super E> action) {
        Objects.requireNonNull(action);

        return this;
    }

    @Override
    public boolean isOkAnd(Predicate<? super V> predicate) {
        Objects.requireNonNull(predicate);

        try {
            return predicate.test(value);
        } catch (Exception ex) {
            LOGGER.debug("Predicate threw on success value, treating it as not matching", ex);
            return false;
        }
    }

    @Override
    public boolean isErrAnd(Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate);

        return false;
    }

    @Override
    public V expect(String message) {
        return value;
    }

    @Override
    public E expectErr(String message) {
        throw UnwrapException.fromExpectErr(message, value);
    }

    @Override
    public Optional<V> ok() {
        return Optional.ofNullable(value);
    }

    @Override
    public Optional<E> err() {
        return Optional.empty();
    }

    // a success never carries an error, so it is one under any error type
    @SuppressWarnings("unchecked")
    private <F> Result<V, F> withErrorType() {
        return (Result<V, F>) (Result<V, ?>) this;
    }
}
