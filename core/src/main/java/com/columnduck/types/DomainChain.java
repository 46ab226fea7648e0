package com.columnduck.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable ordered list of the domains attached to a type, outermost first.
 *
 * <p>The outermost domain is the first one attached. Domains appended later
 * go behind it, so only the outermost domain decides the type's name and
 * its custom text formats.
 */
public final class DomainChain {

    private static final DomainChain EMPTY = new DomainChain(List.of());

    private final List<DataTypeDomain> domains;

    private DomainChain(List<DataTypeDomain> domains) {
        this.domains = domains;
    }

    public static DomainChain empty() {
        return EMPTY;
    }

    /**
     * Returns a chain with {@code domain} added behind the existing domains.
     *
     * @param domain the domain to append
     * @return the new chain
     */
    public DomainChain append(DataTypeDomain domain) {
        Objects.requireNonNull(domain, "domain must not be null");
        List<DataTypeDomain> extended = new ArrayList<>(domains.size() + 1);
        extended.addAll(domains);
        extended.add(domain);
        return new DomainChain(List.copyOf(extended));
    }

    /**
     * Returns the domain consulted for name and format resolution.
     *
     * @return the outermost domain, or empty if no domain is attached
     */
    public Optional<DataTypeDomain> outermost() {
        return domains.isEmpty() ? Optional.empty() : Optional.of(domains.get(0));
    }

    public List<DataTypeDomain> domains() {
        return domains;
    }

    public int size() {
        return domains.size();
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainChain)) return false;
        return domains.equals(((DomainChain) o).domains);
    }

    @Override
    public int hashCode() {
        return domains.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DomainChain[");
        for (int i = 0; i < domains.size(); i++) {
            if (i > 0) sb.append(" -> ");
            sb.append(domains.get(i).getName());
        }
        return sb.append(']').toString();
    }
}
