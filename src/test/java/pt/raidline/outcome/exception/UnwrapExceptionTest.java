package pt.raidline.outcome.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@DisplayName("UnwrapException")
class UnwrapExceptionTest {

    @Test
    @DisplayName("should be an unchecked exception carrying its message")
    void shouldBeUnchecked() {
        var exception = new UnwrapException("message");

        assertInstanceOf(RuntimeException.class, exception);
        assertEquals("message", exception.getMessage());
    }

    @Test
    @DisplayName("factories should put their context before the payload type")
    void factoriesShouldFormatMessages() {
        assertEquals("Called unwrap on a Failure value: java.lang.String",
                UnwrapException.fromUnwrapFailure("boom").getMessage());
        assertEquals("Called unwrapErr on a Success value: java.lang.Integer",
                UnwrapException.fromUnwrapErrOnSuccess(1).getMessage());
        assertEquals("config missing: java.lang.IllegalStateException",
                UnwrapException.fromExpect("config missing", new IllegalStateException()).getMessage());
        assertEquals("expected rejection: null",
                UnwrapException.fromExpectErr("expected rejection", null).getMessage());
    }

    @Test
    @DisplayName("typeName() should use the runtime class name")
    void typeNameShouldUseRuntimeClass() {
        assertEquals("null", UnwrapException.typeName(null));
        assertEquals("java.lang.Long", UnwrapException.typeName(5L));
        assertEquals(List.of().getClass().getName(), UnwrapException.typeName(List.of()));
    }
}
