package org.javai.execerror;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A stable numeric classification of an execution failure.
 *
 * <p>Codes are values, not an enum: every unsigned 32-bit number is a valid code,
 * and numbers outside the declared table describe as {@value #UNKNOWN_DESCRIPTION}.
 * New codes are appended to the end of the table so that shipped codes keep
 * their number.
 *
 * @param value The numeric identity of the code, as unsigned 32-bit bits
 */
public record ErrorCode(int value) {

    static final String UNKNOWN_DESCRIPTION = "Unknown error";

    private static final List<String> DESCRIPTIONS = new ArrayList<>();
    private static final List<ErrorCode> DECLARED = new ArrayList<>();

    public static final ErrorCode GENERIC = declare("Generic error");
    public static final ErrorCode UNKNOWN_ADDRESS = declare("Unknown address");
    public static final ErrorCode INSUFFICIENT_BALANCE = declare("Insufficient balance");
    public static final ErrorCode INVALID_JUMP_DEST = declare("Invalid jump dest");
    public static final ErrorCode INSUFFICIENT_GAS = declare("Insufficient gas");
    public static final ErrorCode MEMORY_OUT_OF_BOUNDS = declare("Memory out of bounds");
    public static final ErrorCode CODE_OUT_OF_BOUNDS = declare("Code out of bounds");
    public static final ErrorCode INPUT_OUT_OF_BOUNDS = declare("Input out of bounds");
    public static final ErrorCode RETURN_DATA_OUT_OF_BOUNDS = declare("Return data out of bounds");
    public static final ErrorCode CALL_STACK_OVERFLOW = declare("Call stack overflow");
    public static final ErrorCode CALL_STACK_UNDERFLOW = declare("Call stack underflow");
    public static final ErrorCode DATA_STACK_OVERFLOW = declare("Data stack overflow");
    public static final ErrorCode DATA_STACK_UNDERFLOW = declare("Data stack underflow");
    public static final ErrorCode INVALID_CONTRACT = declare("Invalid contract");
    public static final ErrorCode NATIVE_CONTRACT_CODE_COPY = declare("Tried to copy native contract code");
    public static final ErrorCode EXECUTION_ABORTED = declare("Execution aborted");
    public static final ErrorCode EXECUTION_REVERTED = declare("Execution reverted");
    public static final ErrorCode PERMISSION_DENIED = declare("Permission denied");
    public static final ErrorCode NATIVE_FUNCTION = declare("Native function error");
    public static final ErrorCode EVENT_PUBLISH = declare("Event publish error");
    public static final ErrorCode INVALID_STRING = declare("Invalid string");
    public static final ErrorCode EVENT_MAPPING = declare("Event mapping error");
    public static final ErrorCode INVALID_ADDRESS = declare("Invalid address");
    public static final ErrorCode DUPLICATE_ADDRESS = declare("Duplicate address");
    public static final ErrorCode INSUFFICIENT_FUNDS = declare("Insufficient funds");
    public static final ErrorCode OVERPAYMENT = declare("Overpayment");
    public static final ErrorCode ZERO_PAYMENT = declare("Zero payment error");
    public static final ErrorCode INVALID_SEQUENCE = declare("Invalid sequence number");
    public static final ErrorCode RESERVED_ADDRESS = declare("Address is reserved for SNative or internal use");
    public static final ErrorCode ILLEGAL_WRITE = declare("Callee attempted to illegally modify state");
    public static final ErrorCode INTEGER_OVERFLOW = declare("Integer overflow");
    public static final ErrorCode INVALID_PROPOSAL = declare("Proposal is invalid");
    public static final ErrorCode EXPIRED_PROPOSAL = declare("Proposal is expired since sequence number does not match");
    public static final ErrorCode PROPOSAL_EXECUTED = declare("Proposal has already been executed");
    public static final ErrorCode NO_INPUT_PERMISSION = declare("Account has no input permission");
    public static final ErrorCode ALREADY_VOTED = declare("Vote already registered for this address");
    // Append new codes here. Never reorder the lines above.

    private static ErrorCode declare(String description) {
        ErrorCode code = new ErrorCode(DESCRIPTIONS.size());
        DESCRIPTIONS.add(description);
        DECLARED.add(code);
        return code;
    }

    /**
     * Returns the code with the given numeric identity, declared or not.
     * {@code value} is read as unsigned.
     */
    public static ErrorCode of(int value) {
        if (Integer.compareUnsigned(value, DECLARED.size()) < 0) {
            return DECLARED.get(value);
        }
        return new ErrorCode(value);
    }

    /**
     * Returns the code for an unsigned 32-bit value held in a {@code long}.
     *
     * @throws IllegalArgumentException if {@code value} does not fit in 32 unsigned bits
     */
    public static ErrorCode ofUnsigned(long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("value out of unsigned 32-bit range: " + value);
        }
        return of((int) value);
    }

    /**
     * Returns all declared codes in numeric order.
     */
    public static List<ErrorCode> values() {
        return Collections.unmodifiableList(DECLARED);
    }

    /**
     * Returns the canonical description, or {@value #UNKNOWN_DESCRIPTION} for an
     * undeclared code.
     */
    public String description() {
        return isKnown() ? DESCRIPTIONS.get(value) : UNKNOWN_DESCRIPTION;
    }

    public boolean isKnown() {
        return Integer.compareUnsigned(value, DESCRIPTIONS.size()) < 0;
    }

    public long unsignedValue() {
        return Integer.toUnsignedLong(value);
    }

    @Override
    public String toString() {
        return "Error " + Integer.toUnsignedString(value) + ": " + description();
    }
}
