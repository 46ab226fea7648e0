package com.columnduck.types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Attaches domains to a data type, producing a new immutable descriptor.
 *
 * <p>The builder is the only mutable phase of a descriptor's life: it is used
 * by one thread during setup, and {@link #build()} returns a descriptor that
 * can be shared freely.
 *
 * <p>Example usage:
 * <pre>
 *   DataType ipv4 = DataTypeBuilder.forType(UInt32Type.get())
 *       .appendDomain(new IPv4Domain())
 *       .build();
 * </pre>
 *
 * <p>Appending to an already-decorated type keeps its outermost domain in
 * front; the new domain goes behind the existing ones.
 */
public final class DataTypeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DataTypeBuilder.class);

    private final DataType base;
    private DomainChain domains;

    private DataTypeBuilder(DataType base, DomainChain domains) {
        this.base = base;
        this.domains = domains;
    }

    /**
     * Starts from a type, keeping any domains it already carries.
     *
     * @param type the type to decorate
     * @return the builder
     */
    public static DataTypeBuilder forType(DataType type) {
        Objects.requireNonNull(type, "type must not be null");
        if (type instanceof DomainDecoratedType) {
            DomainDecoratedType decorated = (DomainDecoratedType) type;
            return new DataTypeBuilder(decorated.getBaseType(), decorated.domains());
        }
        return new DataTypeBuilder(type, DomainChain.empty());
    }

    /**
     * Appends a domain. The first domain attached becomes the outermost one.
     *
     * @param domain the domain
     * @return this builder
     */
    public DataTypeBuilder appendDomain(DataTypeDomain domain) {
        domains = domains.append(domain);
        return this;
    }

    /**
     * Builds the descriptor.
     *
     * @return the base type itself if no domain was attached, otherwise a decorated type
     */
    public DataType build() {
        if (domains.isEmpty()) {
            return base;
        }
        logger.debug("Attached {} to data type {}", domains, base.getName());
        return new DomainDecoratedType(base, domains);
    }
}
