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
 * The failed variant of {@link Result}, holding {@code error}.
 *
 * @param error the error, may be {@code null}
 * @param <V>   the type of the value this result would have carried
 * @param <E>   the type of the error
 */
public record Failure<V, E>(E error) implements Result<V, E> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Failure.class);

    @Override
    public boolean isOk() {
        return false;
    }

    @Override
    public boolean isErr() {
        return true;
    }

    @Override
    public V unwrapOr(V defaultValue) {
        return defaultValue;
    }

    @Override
    public <R> Result<R, E> map(Function<? super V, ? extends R> mapper) {
        Objects.requireNonNull(mapper);

        return withValueType();
    }

    @Override
    public <F> Result<V, F> mapErr(Function<? super E, ? extends F> mapper) {
        Objects.requireNonNull(mapper);

        return new Failure<>(mapper.apply(error));
    }

    @Override
    public <R> Result<R, E> andThen(Function<? super V, ? extends Result<R, E>> mapper) {
        Objects.requireNonNull(mapper);

        return withValueType();
    }

    @Override
    public <F> Result<V, F> orElse(Function<? super E, ? extends Result<V, F>> recovery) {
        Objects.requireNonNull(recovery);

        return recovery.apply(error);
    }

    @Override
    public <R> R match(Function<? super V, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
        Objects.requireNonNull(onOk);
        Objects.requireNonNull(onErr);

        return onErr.apply(error);
    }

    @Override
    public V unwrap() {
        throw UnwrapException.fromUnwrapFailure(error);
    }

    @Override
    public E unwrapErr() {
        return error;
    }

    @Override
    public V unwrapUnchecked() {
        throw UnwrapException.fromUnwrapFailure(error);
    }

    @Override
    public E unwrapErrUnchecked() {
        return error;
    }

    @Override
    public V unwrapOrElse(Function<? super E, ? extends V> fallback) {
        Objects.requireNonNull(fallback);

        return fallback.apply(error);
    }

    @Override
    public V unwrapOrDefault(DefaultValueProvider<? extends V> provider) {
        Objects.requireNonNull(provider);

        return provider.getDefaultValue(UnwrapException.typeName(error));
    }

    @Override
    public Result<V, E> inspect(Consumer<? super V> action) {
        Objects.requireNonNull(action);

        return this;
    }

    @Override
    public Result<V, E> inspectErr(Consumer<? super E> action) {
        Objects.requireNonNull(action);

        try {
            action.accept(error);
        } catch (Exception ex) {
            LOGGER.debug("Ignoring exception thrown while inspecting failure error", ex);
        }
        return this;
    }

    @Override
    public boolean isOkAnd(Predicate<? super V> predicate) {
        Objects.requireNonNull(predicate);

        return false;
    }

    @Override
    public boolean isErrAnd(Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate);

        try {
            return predicate.test(error);
        } catch (Exception ex) {
            LOGGER.debug("Predicate threw on failure error, treating it as not matching", ex);
            return false;
        }
    }

    @Override
    public V expect(String message) {
        throw UnwrapException.fromExpect(message, error);
    }

    @Override
    public E expectErr(String message) {
        return error;
    }

    @Override
    public Optional<V> ok() {
        return Optional.empty();
    }

    @Override
    public Optional<E> err() {
        return Optional.ofNullable(error);
    }

    @SuppressWarnings("unchecked")
    private <R> Result<R, E> withValueType() {
        return (Result<R, E>) (Result<?, E>) this;
    }
}
