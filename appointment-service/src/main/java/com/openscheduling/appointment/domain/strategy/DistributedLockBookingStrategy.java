package com.openscheduling.appointment.domain.strategy;

import com.openscheduling.availability.domain.model.BookingPayload;
import com.openscheduling.availability.domain.model.TimeInterval;
import com.openscheduling.common.exception.BusinessException;
import com.openscheduling.common.exception.StoreUnavailableException;
import com.openscheduling.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Booking strategy using a distributed lock (Redis/Redisson) per resource calendar.
 *
 * Flow:
 * 1. Acquire {@code lock:calendar:<resourceId>} (unassigned bookings share one scope)
 * 2. Inside the lock, run the conflict-checking transaction of {@link ConflictCheckingWriter}
 * 3. The transaction commits before the lock is released
 *
 * The lock is taken outside the transactional writer so no second writer can read the
 * calendar between our check and our commit.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedLockBookingStrategy implements BookingWriteStrategy {

    private static final long LOCK_WAIT_SECONDS = 5;
    private static final long LOCK_LEASE_SECONDS = 30;

    private final ConflictCheckingWriter writer;
    private final RedissonClient redissonClient;

    @Override
    public String create(TimeInterval interval, String resourceId, BookingPayload payload) {
        return withCalendarLock(resourceId, () -> writer.create(interval, resourceId, payload));
    }

    @Override
    public void reschedule(String bookingId, TimeInterval newInterval) {
        String resourceId = writer.resourceOf(bookingId);
        withCalendarLock(resourceId, () -> {
            writer.reschedule(bookingId, newInterval);
            return null;
        });
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private <T> T withCalendarLock(String resourceId, Supplier<T> write) {
        String lockKey = buildLockKey(resourceId);
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(LOCK_WAIT_SECONDS, LOCK_LEASE_SECONDS, TimeUnit.SECONDS);
            if (!acquired) {
                throw new BusinessException(
                        "Unable to acquire calendar lock for resource " + resourceId + ". Please try again.",
                        "LOCK_NOT_ACQUIRED");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            return write.get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Booking interrupted", e, "BOOKING_INTERRUPTED");
        } catch (RedisException e) {
            log.warn("Lock service unavailable for {}: {}", lockKey, e.getMessage());
            throw new StoreUnavailableException("Calendar lock service unavailable", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    private String buildLockKey(String resourceId) {
        return Constants.LOCK_PREFIX + (resourceId != null ? resourceId : Constants.UNASSIGNED_SCOPE);
    }
}
