package pt.raidline.outcome;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UnwrapOrTest {

    @Nested
    @DisplayName("unwrapOr()")
    class UnwrapOrTests {

        @Test
        @DisplayName("should return the value when Success")
        void shouldReturnValueWhenSuccess() {
            assertEquals("value", Result.<String, String>success("value").unwrapOr("default"));
        }

        @Test
        @DisplayName("should return the default when Failure")
        void shouldReturnDefaultWhenFailure() {
            assertEquals(42, Result.<Integer, String>failure("boom").unwrapOr(42));
        }

        @Test
        @DisplayName("should return a null value over the default when Success")
        void shouldPreferNullValue() {
            assertNull(new Success<String, String>(null).unwrapOr("default"));
        }
    }

    @Nested
    @DisplayName("unwrapOrElse()")
    class UnwrapOrElseTests {

        @Test
        @DisplayName("should return the value and never call the fallback when Success")
        void shouldReturnValueWhenSuccess() {
            var calls = new AtomicInteger();

            int value = Result.<Integer, String>success(7).unwrapOrElse(e -> calls.incrementAndGet());

            assertEquals(7, value);
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("should return the fallback's plain value when Failure")
        void shouldReturnFallbackValueWhenFailure() {
            int value = Result.<Integer, String>failure("boom").unwrapOrElse(e -> 42);

            assertEquals(42, value);
        }

        @Test
        @DisplayName("should hand the error to the fallback")
        void shouldPassErrorToFallback() {
            List<String> seen = new ArrayList<>();

            String value = Result.<String, String>failure("boom").unwrapOrElse(e -> {
                seen.add(e);
                return "recovered from " + e;
            });

            assertEquals("recovered from boom", value);
            assertEquals(List.of("boom"), seen);
        }

        @Test
        @DisplayName("should propagate an exception thrown by the fallback")
        void shouldPropagateFallbackException() {
            var result = Result.<String, IOException>failure(new IOException("io"));

            assertThrows(IllegalStateException.class, () -> result.unwrapOrElse(e -> {
                throw new IllegalStateException(e);
            }));
        }
    }

    @Nested
    @DisplayName("unwrapOrDefault()")
    class UnwrapOrDefaultTests {

        private final Map<String, Object> defaults = Map.of(
                "java.lang.String", "",
                "java.io.IOException", 0
        );

        private final DefaultValueProvider<Object> provider = defaults::get;

        @Test
        @DisplayName("should return the value and never consult the provider when Success")
        void shouldReturnValueWhenSuccess() {
            var lookups = new AtomicInteger();

            Object value = Result.<Object, String>success("present").unwrapOrDefault(typeName -> {
                lookups.incrementAndGet();
                return "default";
            });

            assertEquals("present", value);
            assertEquals(0, lookups.get());
        }

        @Test
        @DisplayName("should look the default up by the error's runtime type name")
        void shouldLookUpByErrorTypeName() {
            assertEquals(0, Result.failure(new IOException("io")).unwrapOrDefault(provider));
            assertEquals("", Result.failure("boom").unwrapOrDefault(provider));
        }

        @Test
        @DisplayName("should return null when the provider has no mapping")
        void shouldReturnNullForUnknownType() {
            assertNull(Result.failure(3.5).unwrapOrDefault(provider));
        }

        @Test
        @DisplayName("should key a null error as \"null\"")
        void shouldKeyNullErrorAsNull() {
            List<String> keys = new ArrayList<>();

            new Failure<String, String>(null).unwrapOrDefault(typeName -> {
                keys.add(typeName);
                return "fallback";
            });

            assertEquals(List.of("null"), keys);
        }
    }
}
