package com.openscheduling.appointment;

import com.openscheduling.appointment.domain.model.SchedulableResource;
import com.openscheduling.appointment.domain.repository.SchedulableResourceRepository;
import com.openscheduling.appointment.domain.service.AppointmentBookingService;
import com.openscheduling.appointment.domain.strategy.BookingWriteStrategy;
import com.openscheduling.availability.domain.model.AvailabilitySearchRequest;
import com.openscheduling.availability.domain.model.AvailableSlot;
import com.openscheduling.availability.domain.model.BookingPayload;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.common.exception.BookingConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end booking against PostgreSQL and Redis: concurrent writers of overlapping
 * appointments on one resource, under each booking strategy.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class BookingContentionIntegrationTest {

    private static final int WRITERS = 6;

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("appointments_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configure(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
        registry.add("spring.data.redis.host", REDIS::getHost);
        registry.add("spring.data.redis.port", () -> REDIS.getMappedPort(6379));
    }

    @Autowired
    private Map<String, BookingWriteStrategy> writeStrategies;

    @Autowired
    private SchedulableResourceRepository resourceRepository;

    @Autowired
    private AppointmentBookingService bookingService;

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"distributed", "serializable"})
    @DisplayName("Concurrent overlapping writes: exactly one succeeds, the rest get BookingConflictException")
    void concurrentOverlappingWrites_exactlyOneWins(String strategyName) throws Exception {
        // given
        String resourceId = "artist-" + strategyName;
        resourceRepository.saveAndFlush(SchedulableResource.builder().id(resourceId).displayName(strategyName).build());
        BookingWriteStrategy strategy = writeStrategies.get(strategyName);
        Instant start = nextMondayAt(LocalTime.of(11, 0));

        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(WRITERS);
        List<Future<?>> futures = new ArrayList<>();

        // when: every writer wants an interval overlapping [11:00, 12:00)
        for (int i = 0; i < WRITERS; i++) {
            int offsetMinutes = i * 5;
            futures.add(pool.submit(() -> {
                gate.await();
                try {
                    strategy.create(TimeInterval.ofMinutes(start.plusSeconds(offsetMinutes * 60L), 60),
                            resourceId, new BookingPayload("cust-" + offsetMinutes, null, null));
                    successes.incrementAndGet();
                } catch (BookingConflictException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        gate.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        assertThat(successes.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(WRITERS - 1);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"distributed", "serializable"})
    @DisplayName("Concurrent reschedules onto the same free hour: exactly one succeeds")
    void concurrentReschedules_exactlyOneWins(String strategyName) throws Exception {
        // given: two bookings in the morning, the 14:00 hour free
        String resourceId = "reschedule-" + strategyName;
        resourceRepository.saveAndFlush(SchedulableResource.builder().id(resourceId).displayName(strategyName).build());
        BookingWriteStrategy strategy = writeStrategies.get(strategyName);
        List<String> bookingIds = List.of(
                strategy.create(TimeInterval.ofMinutes(nextMondayAt(LocalTime.of(10, 0)), 60),
                        resourceId, new BookingPayload("cust-a", null, null)),
                strategy.create(TimeInterval.ofMinutes(nextMondayAt(LocalTime.of(11, 0)), 60),
                        resourceId, new BookingPayload("cust-b", null, null)));
        TimeInterval target = TimeInterval.ofMinutes(nextMondayAt(LocalTime.of(14, 0)), 60);

        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(bookingIds.size());
        List<Future<?>> futures = new ArrayList<>();

        // when: both bookings move to [14:00, 15:00) at once
        for (String bookingId : bookingIds) {
            futures.add(pool.submit(() -> {
                gate.await();
                try {
                    strategy.reschedule(bookingId, target);
                    successes.incrementAndGet();
                } catch (BookingConflictException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        gate.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        assertThat(successes.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("A booked hour disappears from search and reappears after cancellation")
    void bookSearchCancel_roundTrip() {
        // given
        String resourceId = "artist-roundtrip";
        resourceRepository.saveAndFlush(SchedulableResource.builder().id(resourceId).displayName("Round trip").build());
        Instant eleven = nextMondayAt(LocalTime.of(11, 0));
        AvailabilitySearchRequest mondayMorning = AvailabilitySearchRequest.builder()
                .rangeStart(nextMondayAt(LocalTime.of(10, 0)))
                .rangeEnd(nextMondayAt(LocalTime.of(13, 0)))
                .resourceIds(Set.of(resourceId))
                .durationMinutes(60)
                .build();

        // when
        String bookingId = bookingService.book(eleven, 60, resourceId, new BookingPayload("cust-1", "consultation", null));

        // then
        assertThat(bookingService.findAvailableSlots(mondayMorning))
                .extracting(slot -> slot.interval().start())
                .containsExactly(nextMondayAt(LocalTime.of(10, 0)), nextMondayAt(LocalTime.of(12, 0)));

        bookingService.cancel(bookingId);
        assertThat(bookingService.findAvailableSlots(mondayMorning)).extracting(AvailableSlot::interval).hasSize(3);
    }

    private static Instant nextMondayAt(LocalTime time) {
        return LocalDate.now(ZoneOffset.UTC)
                .with(TemporalAdjusters.next(DayOfWeek.MONDAY))
                .atTime(time)
                .toInstant(ZoneOffset.UTC);
    }
}
