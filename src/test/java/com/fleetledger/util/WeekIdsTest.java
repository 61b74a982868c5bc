package com.fleetledger.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeekIdsTest {

    @Test
    void parsesYearAndWeek() {
        assertThat(WeekIds.year("2025-6")).isEqualTo(2025);
        assertThat(WeekIds.week("2025-06")).isEqualTo(6);
        assertThat(WeekIds.paddedWeek("2025-6")).isEqualTo("06");
    }

    @Test
    void rejectsOutOfRangeAndMalformed() {
        assertThat(WeekIds.isValid("2025-00")).isFalse();
        assertThat(WeekIds.isValid("2025-54")).isFalse();
        assertThat(WeekIds.isValid("2025/06")).isFalse();
        assertThat(WeekIds.isValid(null)).isFalse();
        assertThatThrownBy(() -> WeekIds.week("06-2025")).isInstanceOf(IllegalArgumentException.class);
    }
}
