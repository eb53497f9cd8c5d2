package org.javai.execerror.boundary;

import org.javai.execerror.ErrorCode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.MalformedInputException;

import static org.assertj.core.api.Assertions.*;

class DefaultErrorCodeClassifierTest {

    private final ErrorCodeClassifier classifier = new DefaultErrorCodeClassifier();

    @Test
    void arithmeticException_isIntegerOverflow() {
        assertThat(classifier.classify("MUL", new ArithmeticException("long overflow")))
                .isEqualTo(ErrorCode.INTEGER_OVERFLOW);
    }

    @Test
    void securityException_isPermissionDenied() {
        assertThat(classifier.classify("op", new SecurityException()))
                .isEqualTo(ErrorCode.PERMISSION_DENIED);
    }

    @Test
    void indexOutOfBounds_isMemoryOutOfBounds() {
        assertThat(classifier.classify("MLOAD", new ArrayIndexOutOfBoundsException(64)))
                .isEqualTo(ErrorCode.MEMORY_OUT_OF_BOUNDS);
        assertThat(classifier.classify("op", new StringIndexOutOfBoundsException(3)))
                .isEqualTo(ErrorCode.MEMORY_OUT_OF_BOUNDS);
    }

    @Test
    void characterCodingException_isInvalidString() {
        assertThat(classifier.classify("decode", new MalformedInputException(2)))
                .isEqualTo(ErrorCode.INVALID_STRING);
    }

    @Test
    void unsupportedOperation_isNativeFunction() {
        assertThat(classifier.classify("native", new UnsupportedOperationException("not wired")))
                .isEqualTo(ErrorCode.NATIVE_FUNCTION);
    }

    @Test
    void otherExceptions_areGeneric() {
        assertThat(classifier.classify("op", new IOException("x"))).isEqualTo(ErrorCode.GENERIC);
        assertThat(classifier.classify("op", new IllegalStateException())).isEqualTo(ErrorCode.GENERIC);
        assertThat(ErrorCodeClassifier.generic().classify("op", new ArithmeticException()))
                .isEqualTo(ErrorCode.GENERIC);
    }
}
