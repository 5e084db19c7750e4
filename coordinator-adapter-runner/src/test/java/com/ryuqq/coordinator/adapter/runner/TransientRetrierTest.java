package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.core.error.StorageException;
import com.ryuqq.coordinator.core.error.TransientInfraException;
import com.ryuqq.coordinator.core.error.ValidationRejectedException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TransientRetrier 유닛 테스트.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
class TransientRetrierTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final TransientRetrier retrier = new TransientRetrier(
        new RetryConfig(3, 10, 100, 0.0), sleeps::add);

    @Test
    void call_일시_장애가_한도_안에서_해소되면_결과를_반환함() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = retrier.call("load", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new StorageException("connection reset");
            }
            return "ok";
        });

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(10L, 20L);
    }

    @Test
    void call_한도를_넘으면_마지막_예외를_던짐() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> retrier.run("append", () -> {
            calls.incrementAndGet();
            throw new StorageException("disk full");
        }))
            .isInstanceOf(StorageException.class)
            .hasMessage("disk full");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void call_일시_장애가_아니면_재시도하지_않음() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> retrier.call("append", () -> {
            calls.incrementAndGet();
            throw ValidationRejectedException.invalidArgument("bad payload");
        })).isInstanceOf(ValidationRejectedException.class);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void call_대기중_인터럽트되면_TransientInfra로_감싸고_인터럽트_상태를_복원함() {
        // given
        TransientRetrier interrupted = new TransientRetrier(new RetryConfig(), millis -> {
            throw new InterruptedException("stop");
        });

        // when & then
        try {
            assertThatThrownBy(() -> interrupted.call("load", () -> {
                throw new StorageException("timeout");
            }))
                .isInstanceOf(TransientInfraException.class)
                .hasMessageContaining("interrupted while retrying");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void constructor_config가_null이면_예외() {
        assertThatThrownBy(() -> new TransientRetrier(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
    }
}
