package org.javai.execerror;

/**
 * Implemented by failures that carry an {@link ErrorCode}.
 *
 * <p>Exceptions from other subsystems can implement this to keep their code when
 * they are converted with {@link CodedExceptions#from(Throwable)}.
 */
public interface Coded {

    ErrorCode errorCode();
}
