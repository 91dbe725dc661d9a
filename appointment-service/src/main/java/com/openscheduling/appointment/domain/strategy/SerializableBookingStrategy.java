package com.openscheduling.appointment.domain.strategy;

import com.openscheduling.availability.domain.model.BookingPayload;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.common.exception.BookingConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.sql.SQLException;
import java.util.List;

/**
 * Booking strategy using SERIALIZABLE transactions with retry.
 *
 * Two concurrent writers of overlapping bookings cannot both commit: the database aborts
 * one with a serialization failure. The aborted write is retried in a fresh transaction,
 * where the conflict re-check now sees the winner's row and raises
 * {@link BookingConflictException}. If every attempt is aborted the write is reported as a
 * conflict as well.
 */
@Slf4j
@Component("serializable")
@RequiredArgsConstructor
public class SerializableBookingStrategy implements BookingWriteStrategy {

    private static final String SERIALIZATION_FAILURE = "40001";

    private final ConflictCheckingWriter writer;

    @Override
    @Retryable(
            retryFor = ConcurrencyFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2)
    )
    public String create(TimeInterval interval, String resourceId, BookingPayload payload) {
        try {
            return writer.createSerializable(interval, resourceId, payload);
        } catch (DataAccessException | TransactionException e) {
            throw retryableIfSerializationFailure(e);
        }
    }

    @Override
    @Retryable(
            retryFor = ConcurrencyFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2)
    )
    public void reschedule(String bookingId, TimeInterval newInterval) {
        try {
            writer.rescheduleSerializable(bookingId, newInterval);
        } catch (DataAccessException | TransactionException e) {
            throw retryableIfSerializationFailure(e);
        }
    }

    @Recover
    public String recoverCreate(ConcurrencyFailureException e, TimeInterval interval, String resourceId,
                                BookingPayload payload) {
        log.warn("Giving up booking {} on resource {} after repeated serialization failures", interval, resourceId);
        throw new BookingConflictException(
                String.format("Time %s could not be booked on resource %s under contention", interval, resourceId),
                List.of());
    }

    @Recover
    public void recoverReschedule(ConcurrencyFailureException e, String bookingId, TimeInterval newInterval) {
        log.warn("Giving up moving appointment {} to {} after repeated serialization failures", bookingId, newInterval);
        throw new BookingConflictException(
                String.format("Appointment %s could not be moved to %s under contention", bookingId, newInterval),
                List.of());
    }

    @Override
    public String getStrategyType() {
        return "SERIALIZABLE";
    }

    /**
     * A serialization failure raised at commit reaches us as a generic transaction or JPA
     * exception; it is re-raised as a {@link ConcurrencyFailureException} so it is retried.
     */
    static RuntimeException retryableIfSerializationFailure(RuntimeException e) {
        if (e instanceof ConcurrencyFailureException) {
            return e;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && SERIALIZATION_FAILURE.equals(sql.getSQLState())) {
                return new ConcurrencyFailureException("Serialization failure on commit", e);
            }
        }
        return e;
    }
}
