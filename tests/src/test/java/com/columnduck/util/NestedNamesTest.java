package com.columnduck.util;

import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for nested column names.
 *
 * <p>Test ID prefix: TC-NESTED-NAME-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("NestedNames Tests")
public class NestedNamesTest extends TestBase {

    @Test
    @DisplayName("TC-NESTED-NAME-001: Split at the first dot")
    void testSplitAtFirstDot() {
        NestedNames.SplitName split = NestedNames.splitName("n.a.b");

        assertThat(split.tableName()).isEqualTo("n");
        assertThat(split.fieldName()).isEqualTo("a.b");
        assertThat(split.isNested()).isTrue();
    }

    @Test
    @DisplayName("TC-NESTED-NAME-002: Names without an inner dot are not nested")
    void testNotNested() {
        assertThat(NestedNames.splitName("plain").isNested()).isFalse();
        assertThat(NestedNames.splitName(".leading").tableName()).isEqualTo(".leading");
        assertThat(NestedNames.splitName("trailing.").tableName()).isEqualTo("trailing.");
        assertThat(NestedNames.splitName("trailing.").isNested()).isFalse();
    }

    @Test
    @DisplayName("TC-NESTED-NAME-003: Extract and concatenate")
    void testExtractAndConcatenate() {
        assertThat(NestedNames.extractTableName("n.a")).isEqualTo("n");
        assertThat(NestedNames.extractTableName("x")).isEqualTo("x");
        assertThat(NestedNames.concatenateName("n", "a")).isEqualTo("n.a");
        assertThat(NestedNames.splitName(NestedNames.concatenateName("n", "a")))
            .isEqualTo(new NestedNames.SplitName("n", "a"));
    }
}
