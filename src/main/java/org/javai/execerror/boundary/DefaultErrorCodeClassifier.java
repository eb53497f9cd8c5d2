package org.javai.execerror.boundary;

import org.javai.execerror.ErrorCode;

import java.nio.charset.CharacterCodingException;

/**
 * Default classifier for JDK exceptions raised while executing contract code.
 * Unrecognized exceptions are {@link ErrorCode#GENERIC}.
 */
public class DefaultErrorCodeClassifier implements ErrorCodeClassifier {

    @Override
    public ErrorCode classify(String operation, Throwable t) {
        // Math.addExact and friends
        if (t instanceof ArithmeticException) {
            return ErrorCode.INTEGER_OVERFLOW;
        }

        if (t instanceof SecurityException) {
            return ErrorCode.PERMISSION_DENIED;
        }

        if (t instanceof ArrayIndexOutOfBoundsException || t instanceof StringIndexOutOfBoundsException) {
            return ErrorCode.MEMORY_OUT_OF_BOUNDS;
        }

        if (t instanceof CharacterCodingException) {
            return ErrorCode.INVALID_STRING;
        }

        if (t instanceof UnsupportedOperationException) {
            return ErrorCode.NATIVE_FUNCTION;
        }

        return ErrorCode.GENERIC;
    }
}
