package com.columnduck.exception;

/**
 * Error codes carried by {@link DataTypeException}.
 *
 * <p>Every code describes a deterministic misuse or malformed input. None of
 * them is transient, so callers never retry on them.
 */
public enum ErrorCode {

    /** Binary bulk (de)serialization requested on a type that needs several substreams. */
    MULTIPLE_STREAMS_REQUIRED,

    /** An internal invariant was violated. */
    LOGICAL_ERROR,

    /** Numeric promotion requested on a type with no wider representation. */
    DATA_TYPE_CANNOT_BE_PROMOTED,

    /** Neither the domain nor the type implements the requested text format and direction. */
    FORMAT_NOT_SUPPORTED,

    /** Text input could not be parsed as a value of the type. */
    CANNOT_PARSE_TEXT,

    /** A byte source ended before a complete value was read. */
    CANNOT_READ_ALL_DATA,

    /** The column passed to a type is not the implementation that type works with. */
    ILLEGAL_COLUMN,

    /** A value of the wrong Java class was inserted into a column. */
    ILLEGAL_TYPE_OF_ARGUMENT,

    /** Arrays of one nested structure have different sizes in the same row. */
    SIZES_OF_ARRAYS_DOESNT_MATCH
}
