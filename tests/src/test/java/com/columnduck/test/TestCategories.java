package com.columnduck.test;

import org.junit.jupiter.api.Tag;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tag annotations for selecting test subsets, e.g. {@code -Dgroups=tier1}.
 */
public final class TestCategories {

    private TestCategories() {}

    // ==================== Tiers ====================

    /** Fast tests run on every build. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier1")
    public @interface Tier1 {}

    /** Slower tests covering larger data. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier2")
    public @interface Tier2 {}

    // ==================== Kinds ====================

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("unit")
    public @interface Unit {}

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("integration")
    public @interface Integration {}

    // ==================== Areas ====================

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("type-mapping")
    public @interface TypeMapping {}

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("serialization")
    public @interface Serialization {}
}
