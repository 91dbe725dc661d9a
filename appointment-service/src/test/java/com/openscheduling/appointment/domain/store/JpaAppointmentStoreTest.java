package com.openscheduling.appointment.domain.store;

import com.openscheduling.appointment.domain.model.Appointment;
import com.openscheduling.appointment.domain.model.SchedulableResource;
import com.openscheduling.appointment.domain.repository.AppointmentRepository;
import com.openscheduling.appointment.domain.repository.SchedulableResourceRepository;
import com.openscheduling.appointment.domain.strategy.BookingWriteStrategy;
import com.openscheduling.appointment.domain.strategy.ConflictCheckingWriter;
import com.openscheduling.availability.domain.model.BookingStatus;
import com.openscheduling.availability.domain.model.ExistingBooking;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.common.exception.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class JpaAppointmentStoreTest {

    private static final TimeInterval MONDAY = new TimeInterval(
            Instant.parse("2024-01-15T00:00:00Z"), Instant.parse("2024-01-16T00:00:00Z"));

    @Mock
    private BookingWriteStrategy distributed;

    @Mock
    private BookingWriteStrategy serializable;

    @Mock
    private ConflictCheckingWriter writer;

    @Mock
    private AppointmentRepository appointmentRepository;

    @Mock
    private SchedulableResourceRepository resourceRepository;

    private JpaAppointmentStore store;

    @BeforeEach
    void setUp() {
        store = new JpaAppointmentStore(Map.of("distributed", distributed, "serializable", serializable),
                writer, appointmentRepository, resourceRepository);
        ReflectionTestUtils.setField(store, "strategyType", "distributed");
    }

    @Test
    @DisplayName("listBookings() maps appointments to bookings, scoped by resource when given")
    void listBookings_mapsAppointments() {
        Appointment appointment = Appointment.builder()
                .id(3L)
                .resourceId("artist-1")
                .startTime(Instant.parse("2024-01-15T10:00:00Z"))
                .endTime(Instant.parse("2024-01-15T11:00:00Z"))
                .status(BookingStatus.CONFIRMED)
                .build();
        given(appointmentRepository.findActiveOverlappingForResources(MONDAY.start(), MONDAY.end(), Set.of("artist-1")))
                .willReturn(List.of(appointment));

        List<ExistingBooking> bookings = store.listBookings(MONDAY, Set.of("artist-1"));

        assertThat(bookings).containsExactly(new ExistingBooking(
                "3", appointment.interval(), "artist-1", BookingStatus.CONFIRMED));
    }

    @Test
    @DisplayName("listBookings() without resources reads every booking")
    void listBookings_allResources() {
        given(appointmentRepository.findActiveOverlapping(MONDAY.start(), MONDAY.end())).willReturn(List.of());

        assertThat(store.listBookings(MONDAY, null)).isEmpty();
    }

    @Test
    @DisplayName("Database failures are translated to StoreUnavailableException")
    void listBookings_translatesFailure() {
        given(appointmentRepository.findActiveOverlapping(MONDAY.start(), MONDAY.end()))
                .willThrow(new DataAccessResourceFailureException("connection reset"));

        assertThatThrownBy(() -> store.listBookings(MONDAY, null))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @DisplayName("Writes go through the configured strategy")
    void createBooking_usesConfiguredStrategy() {
        ReflectionTestUtils.setField(store, "strategyType", "SERIALIZABLE");
        given(serializable.create(MONDAY, "artist-1", null)).willReturn("9");

        assertThat(store.createBooking(MONDAY, "artist-1", null)).isEqualTo("9");
        verifyNoInteractions(distributed);
    }

    @Test
    @DisplayName("An unknown strategy name falls back to distributed")
    void createBooking_unknownStrategyFallsBack() {
        ReflectionTestUtils.setField(store, "strategyType", "optimistic");
        given(distributed.create(MONDAY, null, null)).willReturn("10");

        assertThat(store.createBooking(MONDAY, null, null)).isEqualTo("10");
    }

    @Test
    @DisplayName("updateBookingTime() and cancelBooking() delegate to the write path")
    void updateAndCancel_delegate() {
        store.updateBookingTime("4", MONDAY);
        store.cancelBooking("4");

        verify(distributed).reschedule("4", MONDAY);
        verify(writer).cancel("4");
    }

    @Test
    @DisplayName("listResourceIds() returns the active resources")
    void listResourceIds_activeOnly() {
        given(resourceRepository.findByActiveTrueOrderByIdAsc()).willReturn(List.of(
                SchedulableResource.builder().id("artist-1").displayName("Ana").build(),
                SchedulableResource.builder().id("artist-2").displayName("Bo").build()));

        assertThat(store.listResourceIds()).containsExactly("artist-1", "artist-2");
    }
}
