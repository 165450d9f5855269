package com.websweep.core.analyzer.components;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VersionComparatorTest {

    private static final List<String> LISTED = List.of("1.9", "1.12", "3.4");

    @Test
    @DisplayName("목록에 있거나, 하위 패치이거나, 가장 높은 목록 버전 이하이면 취약")
    void vulnerableRules() {
        assertThat(VersionComparator.isVulnerable("1.9", LISTED)).isTrue();
        assertThat(VersionComparator.isVulnerable("1.12.4", LISTED)).isTrue();
        assertThat(VersionComparator.isVulnerable("2.1", LISTED)).isTrue();
        assertThat(VersionComparator.isVulnerable("3.4.0", LISTED)).isTrue();
    }

    @Test
    @DisplayName("가장 높은 목록 버전보다 크면 안전")
    void newerIsSafe() {
        assertThat(VersionComparator.isVulnerable("3.5", LISTED)).isFalse();
        assertThat(VersionComparator.isVulnerable("99.0", LISTED)).isFalse();
    }

    @Test
    @DisplayName("숫자 비교는 자리별이고 빈 자리는 0")
    void numericCompare() {
        int[] a = VersionComparator.parse("1.10").orElseThrow();
        int[] b = VersionComparator.parse("1.9").orElseThrow();
        assertThat(VersionComparator.compare(a, b)).isPositive();
        assertThat(VersionComparator.compare(VersionComparator.parse("1.9").orElseThrow(),
                VersionComparator.parse("1.9.0").orElseThrow())).isZero();
        assertThat(VersionComparator.parse("1.x")).isEmpty();
    }
}
