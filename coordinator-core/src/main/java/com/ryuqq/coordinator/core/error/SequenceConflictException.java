package com.ryuqq.coordinator.core.error;

/**
 * 해결되지 않은 sequence 충돌.
 *
 * <p>저장소의 compare-and-append가 실패했거나, Explicit 전략에서 병합이 불가능한 경우 발생합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public class SequenceConflictException extends CoordinatorException {

    private final long expected;
    private final long actual;

    /**
     * 생성자.
     *
     * @param expected 호출자가 기대한 sequence
     * @param actual 저장소의 실제 다음 sequence
     */
    public SequenceConflictException(long expected, long actual) {
        this(expected, actual, "Sequence mismatch: expected " + expected + ", actual " + actual);
    }

    public SequenceConflictException(long expected, long actual, String message) {
        super(ErrorKind.SEQUENCE_CONFLICT, StatusCode.ABORTED, message);
        this.expected = expected;
        this.actual = actual;
    }

    public long getExpected() {
        return expected;
    }

    public long getActual() {
        return actual;
    }
}
