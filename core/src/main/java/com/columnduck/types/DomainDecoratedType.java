package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.format.FormatCapabilities;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;
import com.columnduck.types.stream.SubstreamPath;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A data type with one or more domains attached.
 *
 * <p>Everything except the name and the domain-overridden text formats is
 * delegated to the undecorated base type. Instances are created only by
 * {@link DataTypeBuilder}.
 */
public final class DomainDecoratedType extends DataType {

    private final DataType base;
    private final DomainChain domains;

    DomainDecoratedType(DataType base, DomainChain domains) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.domains = Objects.requireNonNull(domains, "domains must not be null");
        if (domains.isEmpty()) {
            throw new IllegalArgumentException("DomainDecoratedType requires at least one domain");
        }
    }

    /**
     * Returns the undecorated type.
     *
     * @return the base type
     */
    public DataType getBaseType() {
        return base;
    }

    @Override
    public DomainChain domains() {
        return domains;
    }

    @Override
    public String getFamilyName() {
        return base.getFamilyName();
    }

    @Override
    protected String doGetName() {
        return base.doGetName();
    }

    @Override
    public Column createColumn() {
        return base.createColumn();
    }

    @Override
    public Object getDefault() {
        return base.getDefault();
    }

    @Override
    public void insertDefaultInto(Column column) {
        base.insertDefaultInto(column);
    }

    @Override
    public DataType promoteNumericType() {
        return base.promoteNumericType();
    }

    @Override
    public int getSizeOfValueInMemory() {
        return base.getSizeOfValueInMemory();
    }

    @Override
    public boolean isNullable() {
        return base.isNullable();
    }

    @Override
    public boolean canBeInsideNullable() {
        return base.canBeInsideNullable();
    }

    @Override
    public boolean haveSubtypes() {
        return base.haveSubtypes();
    }

    @Override
    public boolean isValueRepresentedByNumber() {
        return base.isValueRepresentedByNumber();
    }

    @Override
    public boolean haveMaximumSizeOfValue() {
        return base.haveMaximumSizeOfValue();
    }

    @Override
    public int getMaximumSizeOfValueInMemory() {
        return base.getMaximumSizeOfValueInMemory();
    }

    @Override
    public void serializeBinaryBulk(Column column, ByteSink out, int offset, int limit) {
        base.serializeBinaryBulk(column, out, offset, limit);
    }

    @Override
    public void deserializeBinaryBulk(Column column, ByteSource in, int limit, double avgValueSizeHint) {
        base.deserializeBinaryBulk(column, in, limit, avgValueSizeHint);
    }

    @Override
    public void enumerateStreams(Consumer<SubstreamPath> callback, SubstreamPath path) {
        base.enumerateStreams(callback, path);
    }

    @Override
    public void serializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSink> getter,
                                                       int offset, int limit, SubstreamPath path) {
        base.serializeBinaryBulkWithMultipleStreams(column, getter, offset, limit, path);
    }

    @Override
    public void deserializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSource> getter,
                                                         int limit, double avgValueSizeHint, SubstreamPath path) {
        base.deserializeBinaryBulkWithMultipleStreams(column, getter, limit, avgValueSizeHint, path);
    }

    @Override
    public FormatCapabilities textFormats() {
        return base.textFormats();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DomainDecoratedType)) return false;
        DomainDecoratedType that = (DomainDecoratedType) obj;
        return base.equals(that.base) && getName().equals(that.getName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, getName());
    }
}
