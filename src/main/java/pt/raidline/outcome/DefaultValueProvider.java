package pt.raidline.outcome;

/**
 * Supplies a placeholder value for a type name, consulted by {@link Result#unwrapOrDefault}.
 * <p>
 * Implementations decide their own catalogue. Returning {@code null} for an unknown name is allowed.
 *
 * <h4>Example</h4>
 * <pre>{@code
 * DefaultValueProvider<Integer> zero = typeName -> 0;
 * int count = Result.<Integer, String>failure("timeout").unwrapOrDefault(zero);
 * // count == 0
 * }</pre>
 *
 * @param <T> the type of the default value
 */
@FunctionalInterface
public interface DefaultValueProvider<T> {

    /**
     * @param typeName the runtime type name of the failure payload,
     *                 as given by {@link pt.raidline.outcome.exception.UnwrapException#typeName(Object)}
     * @return the default value for that name, possibly {@code null}
     */
    T getDefaultValue(String typeName);
}
