package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.core.model.EventBook;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 고정 용량 큐 기반 StreamSink.
 *
 * <p>큐가 가득 차면 {@link #offer}가 false를 반환하므로 느린 소비자의 stream은 닫힙니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class QueueStreamSink implements StreamSink {

    private final BlockingQueue<EventBook> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<Runnable> closeCallbacks = new CopyOnWriteArrayList<>();

    public QueueStreamSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public boolean offer(EventBook book) {
        return !closed.get() && queue.offer(book);
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void onClose(Runnable callback) {
        closeCallbacks.add(callback);
        if (closed.get() && closeCallbacks.remove(callback)) {
            callback.run();
        }
    }

    /**
     * 다음 book 대기.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return book (시간 초과 시 null)
     * @throws InterruptedException 대기 중 인터럽트
     */
    public EventBook poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }

    /**
     * Stream 종료. 등록된 close 콜백을 한 번씩 호출합니다.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            for (Runnable callback : closeCallbacks) {
                if (closeCallbacks.remove(callback)) {
                    callback.run();
                }
            }
        }
    }
}
