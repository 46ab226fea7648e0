package com.columnduck.exception;

import java.util.Objects;

/**
 * Exception thrown by data types, columns and codecs.
 *
 * <p>Carries an {@link ErrorCode} and, when known, the name of the data type
 * the failed operation was invoked on. All failures are synchronous and are
 * never retried inside the type layer.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       type.serializeBinaryBulk(column, sink, 0, 0);
 *   } catch (DataTypeException e) {
 *       if (e.getErrorCode() == ErrorCode.MULTIPLE_STREAMS_REQUIRED) {
 *           type.serializeBinaryBulkWithMultipleStreams(column, getter, 0, 0, SubstreamPath.EMPTY);
 *       }
 *   }
 * </pre>
 */
public class DataTypeException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String typeName;

    /**
     * Creates a data type exception.
     *
     * @param errorCode the error code
     * @param message the error message
     * @param typeName the name of the type involved, or null
     */
    public DataTypeException(ErrorCode errorCode, String message, String typeName) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.typeName = typeName;
    }

    /**
     * Creates a data type exception with a cause.
     *
     * @param errorCode the error code
     * @param message the error message
     * @param cause the underlying cause
     * @param typeName the name of the type involved, or null
     */
    public DataTypeException(ErrorCode errorCode, String message, Throwable cause, String typeName) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.typeName = typeName;
    }

    /**
     * Creates a data type exception not tied to a particular type.
     *
     * @param errorCode the error code
     * @param message the error message
     */
    public DataTypeException(ErrorCode errorCode, String message) {
        this(errorCode, message, (String) null);
    }

    public static DataTypeException multipleStreamsRequired(String typeName, boolean serialize) {
        return new DataTypeException(ErrorCode.MULTIPLE_STREAMS_REQUIRED,
            "Data type " + typeName + " must be " + (serialize ? "serialized" : "deserialized")
                + " with multiple streams",
            typeName);
    }

    public static DataTypeException cannotBePromoted(String typeName) {
        return new DataTypeException(ErrorCode.DATA_TYPE_CANNOT_BE_PROMOTED,
            "Data type " + typeName + " can't be promoted.", typeName);
    }

    public static DataTypeException notFixedSize(String typeName) {
        return new DataTypeException(ErrorCode.LOGICAL_ERROR,
            "Value of type " + typeName + " in memory is not of fixed size.", typeName);
    }

    public static DataTypeException cannotParse(String what, String typeName) {
        return new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
            "Cannot parse " + what + " as " + typeName, typeName);
    }

    public static DataTypeException illegalColumn(String columnClass, String typeName) {
        return new DataTypeException(ErrorCode.ILLEGAL_COLUMN,
            "Illegal column " + columnClass + " for data type " + typeName, typeName);
    }

    /**
     * Returns the error code.
     *
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns the name of the data type involved.
     *
     * @return the type name, or null if the failure is not tied to a type
     */
    public String getTypeName() {
        return typeName;
    }
}
