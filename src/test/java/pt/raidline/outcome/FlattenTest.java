package pt.raidline.outcome;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Result.flatten()")
class FlattenTest {

    @Test
    @DisplayName("should return the inner result of a Success")
    void shouldReturnInnerResult() {
        Result<Integer, String> inner = Result.failure("inner failure");
        Result<Result<Integer, String>, String> nested = Result.success(inner);

        assertSame(inner, Result.flatten(nested));
    }

    @Test
    @DisplayName("should keep the outer Failure's error")
    void shouldKeepOuterFailure() {
        Result<Result<Integer, String>, String> nested = Result.failure("outer failure");

        var flat = Result.flatten(nested);

        assertTrue(flat.isErr());
        assertEquals("outer failure", flat.unwrapErr());
    }

    @Test
    @DisplayName("should treat a Success holding null as Success(null)")
    void shouldFlattenNullInnerToSuccess() {
        Result<Result<Integer, String>, String> nested = Result.success(null);

        var flat = Result.flatten(nested);

        assertTrue(flat.isOk());
        assertNull(flat.unwrap());
    }
}
