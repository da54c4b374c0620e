package com.barthel.spi.domain.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CalendarUtilsTest {

    @Test
    void fractionalMonthsCountsWholeMonthsThenRemainder() {
        assertThat(CalendarUtils.fractionalMonthsBetween(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 2, 1)))
                .isEqualTo(1.0);
        assertThat(CalendarUtils.fractionalMonthsBetween(LocalDate.of(2021, 1, 16), LocalDate.of(2021, 1, 31)))
                .isCloseTo(15.0 / 31.0, within(1e-12));
        assertThat(CalendarUtils.fractionalMonthsBetween(LocalDate.of(2021, 1, 16), LocalDate.of(2021, 4, 15)))
                .isCloseTo(2.0 + 30.0 / 31.0, within(1e-12));
    }

    @Test
    void roundedMonthsRoundsHalfUp() {
        assertThat(CalendarUtils.roundedMonthsBetween(LocalDate.of(2021, 1, 16), LocalDate.of(2021, 1, 31))).isZero();
        assertThat(CalendarUtils.roundedMonthsBetween(LocalDate.of(2021, 1, 16), LocalDate.of(2021, 2, 1))).isEqualTo(1);
    }

    @Test
    void seasonalDayFoldsLeapDay() {
        assertThat(CalendarUtils.seasonalDay(LocalDate.of(2020, 2, 29)))
                .isEqualTo(CalendarUtils.seasonalDay(LocalDate.of(2021, 2, 28)))
                .isEqualTo(59);
        assertThat(CalendarUtils.seasonalDay(LocalDate.of(2020, 3, 1))).isEqualTo(60);
        assertThat(CalendarUtils.seasonalDay(LocalDate.of(2020, 12, 31))).isEqualTo(365);
    }

    @Test
    void seasonalDistanceWrapsAtYearEnd() {
        assertThat(CalendarUtils.seasonalDistance(1, 365)).isEqualTo(1);
        assertThat(CalendarUtils.seasonalDistance(10, 200)).isEqualTo(175);
        assertThat(CalendarUtils.seasonalDistance(32, 32)).isZero();
    }
}
