package com.ryuqq.spreadfork.fork.lock;

import com.ryuqq.spreadfork.core.model.ForkId;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 재계산 락 임대(lease).
 *
 * <p>{@link RecalcLockTable#acquire(ForkId)}가 돌려주는 핸들로, 참조 하나를 보유합니다.
 * {@link #close()}는 잡고 있는 락을 풀고 참조를 반납하며, 마지막 참조가 반납되면
 * 테이블 엔트리가 정리될 수 있습니다.</p>
 *
 * <pre>{@code
 * try (RecalcLease lease = table.acquire(forkId)) {
 *     if (!lease.lock(Duration.ofSeconds(60))) {
 *         throw new LockTimeoutException(...);
 *     }
 *     // recalculate
 * }
 * }</pre>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class RecalcLease implements AutoCloseable {

    private final ForkId forkId;
    private final RecalcLockTable.Stripe stripe;
    private final RecalcLockTable table;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    RecalcLease(ForkId forkId, RecalcLockTable.Stripe stripe, RecalcLockTable table) {
        this.forkId = forkId;
        this.stripe = stripe;
        this.table = table;
    }

    public ForkId forkId() {
        return forkId;
    }

    /**
     * 제한 시간 안에 락 획득을 시도합니다.
     *
     * @param timeout 최대 대기 시간
     * @return 획득 성공 여부
     * @throws IllegalStateException 이미 닫힌 lease이거나 대기 중 인터럽트된 경우
     */
    public boolean lock(Duration timeout) {
        ensureOpen();
        try {
            return stripe.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for recalc lock of " + forkId.getValue(), e);
        }
    }

    /**
     * 즉시 락 획득을 시도합니다.
     *
     * @return 획득 성공 여부
     */
    public boolean tryLock() {
        ensureOpen();
        return stripe.lock.tryLock();
    }

    public void unlock() {
        if (stripe.lock.isHeldByCurrentThread()) {
            stripe.lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return stripe.lock.isHeldByCurrentThread();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 락을 잡고 있으면 풀고, 참조를 한 번만 반납합니다.
     */
    @Override
    public void close() {
        while (stripe.lock.isHeldByCurrentThread()) {
            stripe.lock.unlock();
        }
        if (closed.compareAndSet(false, true)) {
            table.release(forkId, stripe);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("recalc lease already closed: " + forkId.getValue());
        }
    }
}
