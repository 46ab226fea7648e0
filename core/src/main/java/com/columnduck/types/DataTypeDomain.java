package com.columnduck.types;

import com.columnduck.format.FormatCapabilities;

/**
 * Auxiliary semantics layered over an existing data type without subclassing it.
 *
 * <p>A domain overrides the display name of the type it decorates and may
 * override text (de)serialization per format and direction. Formats and
 * directions absent from {@link #textFormats()} are handled by the base type.
 *
 * @see DataTypeBuilder#appendDomain(DataTypeDomain)
 * @see IPv4Domain
 */
public interface DataTypeDomain {

    /**
     * Returns the name the decorated type reports.
     *
     * @return the domain name
     */
    String getName();

    /**
     * Returns the text formats this domain implements itself.
     *
     * @return the format table, empty by default
     */
    default FormatCapabilities textFormats() {
        return FormatCapabilities.none();
    }
}
