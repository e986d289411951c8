package pt.raidline.outcome;

import pt.raidline.outcome.exception.UnwrapException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A container for the outcome of a computation: either a {@link Success} holding a value of type
 * {@code V} or a {@link Failure} holding an error of type {@code E}. Modelled on Rust's {@code Result}.
 * <p>
 * {@code Result} is a sealed interface with exactly two permitted implementations:
 * <ul>
 *   <li>{@link Success} - the computation produced a value</li>
 *   <li>{@link Failure} - the computation produced an error</li>
 * </ul>
 * The interface only declares the operations; each variant spells out its own behaviour.
 * Instances are immutable, every transformation returns a new {@code Result} (or {@code this}
 * when nothing changes). Neither payload is constrained: {@code null} is a legal value and a legal
 * error, the variant alone decides success or failure.
 *
 * <h2>Plain-value versus Result-returning callbacks</h2>
 * Transformations come in pairs so a callback never has to be inspected at runtime:
 * <ul>
 *   <li>{@link #map} wraps whatever the callback returns in a new {@link Success};
 *       {@link #andThen} returns the callback's own {@code Result} as-is.</li>
 *   <li>{@link #mapErr} wraps whatever the callback returns in a new {@link Failure};
 *       {@link #orElse} returns the callback's own {@code Result} as-is.</li>
 * </ul>
 * A {@code Result} that ended up nested anyway can be collapsed with {@link #flatten}.
 *
 * <h2>Callback failures</h2>
 * Callbacks run in-line on the caller's thread. An exception thrown by a callback reaches the caller
 * untouched, except in {@link #inspect}, {@link #inspectErr}, {@link #isOkAnd} and {@link #isErrAnd},
 * which log it at DEBUG and carry on. Unwrapping the wrong variant throws {@link UnwrapException}.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Result<Integer, String> parsed = parse("21");
 *
 * int doubled = parsed
 *     .map(n -> n * 2)
 *     .andThen(n -> n > 100 ? Result.failure("too big") : Result.success(n))
 *     .inspectErr(err -> log.warn("parse failed: {}", err))
 *     .unwrapOr(0);
 *
 * String message = parsed.match(
 *     n -> "Parsed " + n,
 *     err -> "Error: " + err
 * );
 * }</pre>
 *
 * @param <V> the type of the success value
 * @param <E> the type of the error
 * @see Success
 * @see Failure
 */
public sealed interface Result<V, E> permits Failure, Success {

    /**
     * Creates a {@link Success} containing the given value. Same as {@code new Success<>(value)},
     * with the error type left to inference.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<String, IOException> result = Result.success("Hello, World!");
     * }</pre>
     *
     * @param value the success value, may be {@code null}
     * @param <V>   the type of the success value
     * @param <E>   the type of the error
     * @return a {@link Success} containing the value
     */
    static <V, E> Result<V, E> success(V value) {
        return new Success<>(value);
    }

    /**
     * Creates a {@link Failure} containing the given error. Same as {@code new Failure<>(error)},
     * with the value type left to inference.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<String, IOException> result = Result.failure(new IOException("File not found"));
     * }</pre>
     *
     * @param error the error, may be {@code null}
     * @param <V>   the type of the success value
     * @param <E>   the type of the error
     * @return a {@link Failure} containing the error
     */
    static <V, E> Result<V, E> failure(E error) {
        return new Failure<>(error);
    }

    /**
     * Collapses a {@code Result} whose success value is itself a {@code Result}.
     * <p>
     * A {@link Success} yields the inner result ({@code Success(null)} yields {@code Success(null)});
     * a {@link Failure} yields a {@link Failure} with the same error.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<Result<Integer, String>, String> nested = Result.success(21)
     *     .map(n -> Result.success(n * 2));
     *
     * Result<Integer, String> flat = Result.flatten(nested);
     * // Returns Success(42)
     * }</pre>
     *
     * @param nested the doubly-wrapped result
     * @param <V>    the type of the inner success value
     * @param <E>    the type of the error
     * @return the inner result, or the outer failure
     */
    static <V, E> Result<V, E> flatten(Result<? extends Result<V, E>, E> nested) {
        Objects.requireNonNull(nested);

        if (nested.isErr()) {
            return new Failure<>(nested.unwrapErr());
        }

        Result<V, E> inner = nested.unwrap();
        return inner != null ? inner : new Success<>(null);
    }

    /**
     * Converts a {@code List<Result<V, E>>} into a {@code Result<List<V>, E>}.
     * <p>
     * If every element is a {@link Success}, returns a {@link Success} with the values in list order.
     * Otherwise returns a {@link Failure} carrying the error of the first failing element.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * List<Result<Config, String>> configs = List.of(
     *     loadConfig("database.yaml"),
     *     loadConfig("api.yaml")
     * );
     *
     * Result<List<Config>, String> allConfigs = Result.sequence(configs);
     * }</pre>
     *
     * @param items the results to sequence
     * @param <V>   the type of the success value
     * @param <E>   the type of the error
     * @return a {@link Success} with an unmodifiable list of all values, or the first {@link Failure}
     */
    static <V, E> Result<List<V>, E> sequence(List<? extends Result<V, E>> items) {
        Objects.requireNonNull(items);

        List<V> accumulator = new ArrayList<>(items.size());

        for (Result<V, E> item : items) {
            if (item instanceof Failure<V, E> failure) {
                return new Failure<>(failure.error());
            }
            accumulator.add(item.unwrap());
        }

        return new Success<>(Collections.unmodifiableList(accumulator));
    }

    /**
     * Applies a {@code Result}-returning function to each element of a list, collecting the values.
     * <p>
     * Stops at the first {@link Failure}; the remaining elements are never handed to {@code mapper}.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<List<User>, String> users = Result.traverse(
     *     List.of("101", "102", "103"),
     *     id -> repository.findById(id)
     * );
     * }</pre>
     *
     * @param items  the items to traverse
     * @param mapper the function to apply to each item
     * @param <A>    the type of the input items
     * @param <V>    the type of the mapped success value
     * @param <E>    the type of the error
     * @return a {@link Success} with an unmodifiable list of all mapped values, or the first {@link Failure}
     */
    static <A, V, E> Result<List<V>, E> traverse(List<A> items,
                                                 Function<? super A, ? extends Result<V, E>> mapper) {
        Objects.requireNonNull(items);
        Objects.requireNonNull(mapper);

        List<V> results = new ArrayList<>(items.size());

        for (A item : items) {
            Result<V, E> result = mapper.apply(item);

            if (result instanceof Failure<V, E> failure) {
                return new Failure<>(failure.error());
            }
            results.add(result.unwrap());
        }

        return new Success<>(Collections.unmodifiableList(results));
    }

    /**
     * Combines two results with a merge function.
     * <p>
     * If both are {@link Success}, applies {@code merger} to their values and wraps its return value.
     * Otherwise returns a {@link Failure} with the error of {@code first} if it failed, else of
     * {@code second}; the merger is not invoked.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<String, String> fullName = Result.zip(
     *     firstName(),
     *     lastName(),
     *     (first, last) -> first + " " + last
     * );
     * }</pre>
     *
     * @param first  the first result
     * @param second the second result
     * @param merger the function combining both success values
     * @param <A>    the type of the first value
     * @param <B>    the type of the second value
     * @param <R>    the type of the merged value
     * @param <E>    the type of the error
     * @return a {@link Success} with the merged value, or the first {@link Failure} in argument order
     */
    static <A, B, R, E> Result<R, E> zip(Result<A, E> first,
                                         Result<B, E> second,
                                         BiFunction<? super A, ? super B, ? extends R> merger) {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
        Objects.requireNonNull(merger);

        if (first instanceof Failure<A, E> f1) {
            return new Failure<>(f1.error());
        }

        if (second instanceof Failure<B, E> f2) {
            return new Failure<>(f2.error());
        }

        return new Success<>(merger.apply(first.unwrap(), second.unwrap()));
    }

    /**
     * @return {@code true} if this is a {@link Success}
     */
    boolean isOk();

    /**
     * @return {@code true} if this is a {@link Failure}
     */
    boolean isErr();

    /**
     * Returns the success value, or {@code defaultValue} if this is a {@link Failure}.
     * <p>
     * The default is evaluated by the caller either way; use {@link #unwrapOrElse} to compute it lazily.
     *
     * @param defaultValue the value to return on failure
     * @return the success value or {@code defaultValue}
     */
    V unwrapOr(V defaultValue);

    /**
     * Transforms the success value.
     * <p>
     * If this is a {@link Success}, applies {@code mapper} and wraps its return value in a new
     * {@link Success}. If this is a {@link Failure}, returns this unchanged and never calls {@code mapper}.
     * When the mapper itself returns a {@code Result}, use {@link #andThen} instead.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<Integer, String> length = Result.<String, String>success("hello").map(String::length);
     * // Returns Success(5)
     * }</pre>
     *
     * @param mapper the function to apply to the success value
     * @param <R>    the type of the mapped value
     * @return a new {@link Success} with the mapped value, or this {@link Failure}
     */
    <R> Result<R, E> map(Function<? super V, ? extends R> mapper);

    /**
     * Transforms the error.
     * <p>
     * If this is a {@link Failure}, applies {@code mapper} and wraps its return value in a new
     * {@link Failure}. If this is a {@link Success}, returns this unchanged and never calls {@code mapper}.
     * When the mapper itself returns a {@code Result}, use {@link #orElse} instead.
     * <p>
     * Useful for converting domain errors to API errors at service boundaries.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<User, ApiError> apiResult = findUser("123")
     *     .mapErr(e -> new ApiError(404, e.getMessage()));
     * }</pre>
     *
     * @param mapper the function to apply to the error
     * @param <F>    the type of the new error
     * @return a new {@link Failure} with the mapped error, or this {@link Success}
     */
    <F> Result<V, F> mapErr(Function<? super E, ? extends F> mapper);

    /**
     * Chains another {@code Result}-returning operation.
     * <p>
     * If this is a {@link Success}, returns whatever {@code mapper} returns, without wrapping it again.
     * If this is a {@link Failure}, returns this unchanged and never calls {@code mapper}.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<User, String> result = findUser("123")
     *     .andThen(user -> validate(user))
     *     .andThen(user -> save(user));
     * }</pre>
     *
     * @param mapper the function to apply, returning a new Result
     * @param <R>    the type of the new success value
     * @return the result of {@code mapper}, or this {@link Failure}
     */
    <R> Result<R, E> andThen(Function<? super V, ? extends Result<R, E>> mapper);

    /**
     * Recovers from a failure with another {@code Result}-returning operation.
     * <p>
     * If this is a {@link Failure}, returns whatever {@code recovery} returns, without wrapping it again.
     * If this is a {@link Success}, returns this unchanged and never calls {@code recovery}.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Result<User, String> withFallback = findUser("123")
     *     .orElse(error -> findUserInCache("123"));
     * }</pre>
     *
     * @param recovery the function to apply to the error, returning a new Result
     * @param <F>      the type of the new error
     * @return the result of {@code recovery}, or this {@link Success}
     */
    <F> Result<V, F> orElse(Function<? super E, ? extends Result<V, F>> recovery);

    /**
     * Handles both variants, returning a single value.
     * <p>
     * Exactly one of the two functions is called: {@code onOk} for a {@link Success},
     * {@code onErr} for a {@link Failure}.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * ApiResponse response = userResult.match(
     *     user -> new ApiResponse(200, user),
     *     error -> new ApiResponse(404, error.getMessage())
     * );
     * }</pre>
     *
     * @param onOk  the function to apply if this is a Success
     * @param onErr the function to apply if this is a Failure
     * @param <R>   the type of the result
     * @return the return value of the selected function
     */
    <R> R match(Function<? super V, ? extends R> onOk, Function<? super E, ? extends R> onErr);

    /**
     * Extracts the success value.
     *
     * @return the success value
     * @throws UnwrapException if this is a {@link Failure}
     */
    V unwrap();

    /**
     * Extracts the error.
     *
     * @return the error
     * @throws UnwrapException if this is a {@link Success}
     */
    E unwrapErr();

    /**
     * Extracts the success value for callers that already know this is a {@link Success}.
     * <p>
     * Calling it on a {@link Failure} is a programming error; it currently throws the same
     * {@link UnwrapException} as {@link #unwrap()}, but callers must not rely on any particular outcome.
     *
     * @return the success value
     */
    V unwrapUnchecked();

    /**
     * Extracts the error for callers that already know this is a {@link Failure}.
     * Symmetric to {@link #unwrapUnchecked()}.
     *
     * @return the error
     */
    E unwrapErrUnchecked();

    /**
     * Returns the success value, or computes one from the error.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * int port = Result.<Integer, String>failure("missing").unwrapOrElse(err -> 8080);
     * // Returns 8080
     * }</pre>
     *
     * @param fallback the function computing a value from the error, only called on failure
     * @return the success value or the fallback's return value
     */
    V unwrapOrElse(Function<? super E, ? extends V> fallback);

    /**
     * Returns the success value, or asks {@code provider} for a default keyed by the runtime type name
     * of the error (see {@link UnwrapException#typeName(Object)}).
     *
     * @param provider the default value lookup, only consulted on failure
     * @return the success value or the provided default, which may be {@code null}
     */
    V unwrapOrDefault(DefaultValueProvider<? extends V> provider);

    /**
     * Runs {@code action} on the success value for its side effect and returns this.
     * <p>
     * An exception thrown by {@code action} is logged and dropped; the chain always continues.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * findUser("123")
     *     .inspect(user -> audit.record("lookup", user.id()))
     *     .map(User::name);
     * }</pre>
     *
     * @param action the side effect to run, only called on success
     * @return this instance
     */
    Result<V, E> inspect(Consumer<? super V> action);

    /**
     * Runs {@code action} on the error for its side effect and returns this.
     * <p>
     * An exception thrown by {@code action} is logged and dropped; the chain always continues.
     *
     * @param action the side effect to run, only called on failure
     * @return this instance
     */
    Result<V, E> inspectErr(Consumer<? super E> action);

    /**
     * @param predicate the test for the success value, only called on success
     * @return {@code true} if this is a {@link Success} whose value matches; {@code false} otherwise,
     * including when {@code predicate} throws
     */
    boolean isOkAnd(Predicate<? super V> predicate);

    /**
     * @param predicate the test for the error, only called on failure
     * @return {@code true} if this is a {@link Failure} whose error matches; {@code false} otherwise,
     * including when {@code predicate} throws
     */
    boolean isErrAnd(Predicate<? super E> predicate);

    /**
     * Extracts the success value, failing with a caller-supplied message.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Config config = loadConfig().expect("config must be present at startup");
     * }</pre>
     *
     * @param message the context put in front of the error's type name
     * @return the success value
     * @throws UnwrapException if this is a {@link Failure}
     */
    V expect(String message);

    /**
     * Extracts the error, failing with a caller-supplied message.
     *
     * @param message the context put in front of the value's type name
     * @return the error
     * @throws UnwrapException if this is a {@link Success}
     */
    E expectErr(String message);

    /**
     * @return the success value, empty for a {@link Failure} or a {@code null} value
     */
    Optional<V> ok();

    /**
     * @return the error, empty for a {@link Success} or a {@code null} error
     */
    Optional<E> err();
}
