package com.example.releaseservice.support;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReleaseVersionComparatorTest {

    @Test
    void testNumericPartsCompareNumerically() {
        List<String> versions = new ArrayList<>(List.of("1.10.0", "1.2.0", "1.9.3", "0.99"));

        versions.sort(ReleaseVersionComparator.INSTANCE);

        assertThat(versions).containsExactly("0.99", "1.2.0", "1.9.3", "1.10.0");
    }

    @Test
    void testNumericPartSortsBeforeTextPart() {
        assertThat(ReleaseVersionComparator.INSTANCE.compare("2.0.1", "2.0.beta")).isNegative();
        assertThat(ReleaseVersionComparator.INSTANCE.compare("2.0-alpha", "2.0-beta")).isNegative();
    }

    @Test
    void testPrefixSortsFirst_EqualVersionsCompareZero() {
        assertThat(ReleaseVersionComparator.INSTANCE.compare("3.1", "3.1.0")).isNegative();
        assertThat(ReleaseVersionComparator.INSTANCE.compare("3.1.0", "3.1.0")).isZero();
    }

    @Test
    void testNames_DerivedDeterministically() {
        assertThat(ReleaseNames.release("tooling", "1.0.0")).isEqualTo("tooling-1.0.0");
        assertThat(ReleaseNames.revision("tooling-1.0.0", 3)).isEqualTo("tooling-1.0.0-3");
    }
}
