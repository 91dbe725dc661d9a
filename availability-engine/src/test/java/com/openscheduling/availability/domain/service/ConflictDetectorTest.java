package com.openscheduling.availability.domain.service;

import com.openscheduling.availability.domain.model.BookingStatus;
import com.openscheduling.availability.domain.model.ConflictReport;
import com.openscheduling.availability.domain.model.ExistingBooking;
import com.openscheduling.availability.support.InMemoryAppointmentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.openscheduling.availability.support.Fixtures.interval;
import static com.openscheduling.availability.support.Fixtures.monday;
import static org.assertj.core.api.Assertions.assertThat;

class ConflictDetectorTest {

    private InMemoryAppointmentStore store;
    private ConflictDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryAppointmentStore();
        detector = new ConflictDetector(store);
    }

    @Test
    @DisplayName("Overlapping booking is reported with the overlapped part")
    void detect_reportsOverlap() {
        String id = store.add("r1", monday("10:00"), monday("11:00"), BookingStatus.CONFIRMED);

        ConflictReport report = detector.detect(interval("10:30", "11:30"), "r1", null);

        assertThat(report.bookingIds()).containsExactly(id);
        assertThat(report.conflicts().get(0).overlap()).isEqualTo(interval("10:30", "11:00"));
    }

    @Test
    @DisplayName("Touching bookings do not conflict")
    void detect_touchingIsFree() {
        store.add("r1", monday("10:00"), monday("11:00"), BookingStatus.CONFIRMED);

        assertThat(detector.detect(interval("11:00", "12:00"), "r1", null).isEmpty()).isTrue();
        assertThat(detector.detect(interval("09:00", "10:00"), "r1", null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Cancelled bookings never conflict")
    void detect_cancelledIgnored() {
        store.add("r1", monday("10:00"), monday("11:00"), BookingStatus.CANCELLED);

        assertThat(detector.detect(interval("10:00", "11:00"), "r1", null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("The excluded booking is ignored, others still conflict")
    void detect_excludeBooking() {
        String moving = store.add("r1", monday("10:00"), monday("11:00"), BookingStatus.SCHEDULED);
        String other = store.add("r1", monday("11:00"), monday("12:00"), BookingStatus.SCHEDULED);

        assertThat(detector.detect(interval("10:15", "11:15"), "r1", moving).bookingIds()).containsExactly(other);
        assertThat(detector.detect(interval("10:00", "11:00"), "r1", moving).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("With a resource only its bookings count; without one every booking does")
    void detect_resourceScope() {
        String r1 = store.add("r1", monday("10:00"), monday("11:00"), BookingStatus.SCHEDULED);
        String r2 = store.add("r2", monday("10:30"), monday("11:30"), BookingStatus.SCHEDULED);

        assertThat(detector.detect(interval("10:00", "12:00"), "r1", null).bookingIds()).containsExactly(r1);
        assertThat(detector.detect(interval("10:00", "12:00"), "r3", null).isEmpty()).isTrue();
        assertThat(detector.detect(interval("10:00", "12:00"), null, null).bookingIds()).containsExactly(r1, r2);
    }

    @Test
    @DisplayName("findConflicts() orders conflicts chronologically, then by id")
    void findConflicts_ordered() {
        List<ExistingBooking> candidates = List.of(
                new ExistingBooking("b", interval("12:00", "13:00"), "r1", BookingStatus.SCHEDULED),
                new ExistingBooking("c", interval("10:00", "11:00"), "r1", BookingStatus.SCHEDULED),
                new ExistingBooking("a", interval("10:00", "11:00"), "r1", BookingStatus.SCHEDULED),
                new ExistingBooking("d", interval("10:00", "11:00"), "r1", BookingStatus.NO_SHOW));

        ConflictReport report = ConflictDetector.findConflicts(interval("09:00", "17:00"), "r1", null, candidates);

        assertThat(report.bookingIds()).containsExactly("a", "c", "d", "b");
        assertThat(report.proposed()).isEqualTo(interval("09:00", "17:00"));
    }
}
