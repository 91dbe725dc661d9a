package com.openscheduling.availability.domain.model;

import com.openscheduling.common.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.openscheduling.availability.support.Fixtures.interval;
import static com.openscheduling.availability.support.Fixtures.monday;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeIntervalTest {

    @Test
    @DisplayName("overlaps() is symmetric for every pair of sample intervals")
    void overlaps_isSymmetric() {
        List<TimeInterval> samples = List.of(
                interval("09:00", "10:00"),
                interval("09:30", "10:30"),
                interval("10:00", "11:00"),
                interval("08:00", "12:00"),
                interval("09:15", "09:45"),
                interval("13:00", "14:00"));

        for (TimeInterval a : samples) {
            for (TimeInterval b : samples) {
                assertThat(a.overlaps(b))
                        .as("%s vs %s", a, b)
                        .isEqualTo(b.overlaps(a));
            }
        }
    }

    @Test
    @DisplayName("Intervals touching at a boundary do not overlap")
    void touchingIntervals_doNotOverlap() {
        TimeInterval morning = interval("09:00", "10:00");
        TimeInterval next = interval("10:00", "11:00");

        assertThat(morning.overlaps(next)).isFalse();
        assertThat(next.overlaps(morning)).isFalse();
        assertThat(morning.intersection(next)).isEmpty();
    }

    @Test
    @DisplayName("Start-during, end-during and encompassing cases all overlap")
    void overlapCases_allDetected() {
        TimeInterval existing = interval("10:00", "11:00");

        assertThat(interval("10:30", "11:30").overlaps(existing)).isTrue();
        assertThat(interval("09:30", "10:30").overlaps(existing)).isTrue();
        assertThat(interval("09:00", "12:00").overlaps(existing)).isTrue();
        assertThat(interval("10:15", "10:45").overlaps(existing)).isTrue();
    }

    @Test
    @DisplayName("intersection() returns the shared part")
    void intersection_returnsSharedPart() {
        assertThat(interval("09:00", "10:30").intersection(interval("10:00", "11:00")))
                .contains(interval("10:00", "10:30"));
    }

    @Test
    @DisplayName("expand() widens both ends and keeps zero padding as identity")
    void expand_widensBothEnds() {
        TimeInterval booking = interval("10:00", "11:00");

        assertThat(booking.expand(Duration.ofMinutes(15))).isEqualTo(interval("09:45", "11:15"));
        assertThat(booking.expand(Duration.ZERO)).isSameAs(booking);
    }

    @Test
    @DisplayName("An interval whose start is not before its end is rejected")
    void invertedInterval_rejected() {
        assertThatThrownBy(() -> new TimeInterval(monday("11:00"), monday("10:00")))
                .isInstanceOf(InvalidArgumentException.class)
                .extracting("errorCode")
                .isEqualTo("INVALID_ARGUMENT");
        assertThatThrownBy(() -> new TimeInterval(monday("10:00"), monday("10:00")))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("Intervals sort by start, then end")
    void compareTo_ordersByStartThenEnd() {
        List<TimeInterval> sorted = List.of(
                        interval("10:00", "12:00"),
                        interval("09:00", "10:00"),
                        interval("10:00", "11:00"))
                .stream().sorted().toList();

        assertThat(sorted).containsExactly(
                interval("09:00", "10:00"),
                interval("10:00", "11:00"),
                interval("10:00", "12:00"));
    }
}
