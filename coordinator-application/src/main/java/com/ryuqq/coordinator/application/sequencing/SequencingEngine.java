package com.ryuqq.coordinator.application.sequencing;

import com.ryuqq.coordinator.application.repository.EventBookRepository;
import com.ryuqq.coordinator.application.retry.BackoffCalculator;
import com.ryuqq.coordinator.application.retry.Sleeper;
import com.ryuqq.coordinator.core.error.SequenceConflictException;
import com.ryuqq.coordinator.core.error.TransientInfraException;
import com.ryuqq.coordinator.core.merge.FieldPath;
import com.ryuqq.coordinator.core.merge.MergeAnalyzer;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.EventBook;
import com.ryuqq.coordinator.core.model.EventPage;
import com.ryuqq.coordinator.core.model.MergeStrategy;
import com.ryuqq.coordinator.core.state.StateReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sequence 확정 및 충돌 해결 엔진.
 *
 * <p>Command의 primary page에 지정된 전략으로 후보 event의 sequence를 확정하고
 * 저장소에 compare-and-append 합니다. 같은 root에 대한 동시 요청을 프로세스 내에서
 * 직렬화하지 않으며, 정확성은 저장소의 원자적 compare-and-append에만 의존합니다.</p>
 *
 * <p><strong>EXPLICIT:</strong></p>
 * <pre>
 * expected = page.sequence (없으면 전달된 이력의 nextSequence)
 * tip = store.nextSequence
 * expected &gt; tip  → SequenceConflict
 * expected == tip → 그대로 추가 (DIRECT)
 * expected &lt; tip  → base = state(이력[0, expected))
 *                    mine = changedFields(base, base + 후보)
 *                    theirs = changedFields(base, state(현재 이력))
 *                    disjoint → tip으로 재지정하여 추가 (MERGED)
 *                    겹침     → SequenceConflict
 * </pre>
 *
 * <p><strong>AUTO_RESEQUENCE:</strong> 지정된 sequence를 무시하고 tip에 추가합니다. 첫 시도에서도
 * 제공된 이력이 저장소 tip과 다르면 최신 이력을 읽어 handler를 실행합니다. 충돌하면
 * backoff 후 최신 이력을 다시 읽고 handler를 다시 실행합니다. maxAttempts에 도달하면
 * {@link SequenceConflictException}을 던집니다.</p>
 *
 * <p><strong>FORCE:</strong> page에 지정된 sequence(없으면 tip)부터 forced 표시하여 기록합니다.
 * 이 root의 sequence 연속성 보장은 완화됩니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class SequencingEngine {

    private static final Logger log = LoggerFactory.getLogger(SequencingEngine.class);

    private final EventBookRepository repository;
    private final PageAppender appender;
    private final MergeAnalyzer mergeAnalyzer;
    private final Map<String, StateReconstructor<?>> reconstructors;
    private final SequencingConfig config;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    /**
     * 생성자.
     *
     * @param repository 이력 조회기
     * @param appender compare-and-append 쓰기 경로
     * @param mergeAnalyzer 병합 분석기
     * @param reconstructors 도메인별 state 재구성기 (병합에 필요, 없는 도메인은 병합 불가)
     * @param config 설정
     * @param sleeper 재시도 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SequencingEngine(
        EventBookRepository repository,
        PageAppender appender,
        MergeAnalyzer mergeAnalyzer,
        Map<String, StateReconstructor<?>> reconstructors,
        SequencingConfig config,
        Sleeper sleeper
    ) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (mergeAnalyzer == null) {
            throw new IllegalArgumentException("mergeAnalyzer cannot be null");
        }
        if (reconstructors == null) {
            throw new IllegalArgumentException("reconstructors cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.repository = repository;
        this.appender = appender;
        this.mergeAnalyzer = mergeAnalyzer;
        this.reconstructors = Map.copyOf(reconstructors);
        this.config = config;
        this.backoff = new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs(), config.jitterFactor());
        this.sleeper = sleeper;
    }

    /**
     * 후보 event의 sequence를 확정하고 commit.
     *
     * @param command 처리 중인 command (cover의 correlation id가 기록됨)
     * @param history handler에 처음 제공할 이력
     * @param producer 후보 event 계산 함수
     * @return commit 결과
     * @throws SequenceConflictException 충돌을 해결하지 못한 경우
     */
    public SequencingResult sequence(CommandBook command, EventBook history, CandidateProducer producer) {
        CommandPage page = command.primaryPage();
        return switch (page.mergeStrategy()) {
            case EXPLICIT -> explicit(command.cover(), page, history, producer);
            case AUTO_RESEQUENCE -> autoResequence(command.cover(), history, producer);
            case FORCE -> force(command.cover(), page, history, producer);
        };
    }

    // ========================================
    // EXPLICIT
    // ========================================

    private SequencingResult explicit(Cover cover, CommandPage page, EventBook history, CandidateProducer producer) {
        long expected = page.hasSequence() ? page.sequence() : history.nextSequence();
        long tip = repository.nextSequence(cover);
        if (expected > tip) {
            throw new SequenceConflictException(expected, tip,
                "Sequence " + expected + " is ahead of the current tip " + tip + " for " + cover.cacheKey());
        }

        EventBook staleView = history.nextSequence() == expected ? history : repository.loadBefore(cover, expected);
        List<EventPage> candidates = producer.produce(staleView).pages();
        if (candidates.isEmpty()) {
            return new SequencingResult(emptyBook(cover, tip), MergeStrategy.EXPLICIT, Resolution.NO_EVENTS, 0);
        }

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            Resolution resolution = Resolution.DIRECT;
            if (expected < tip) {
                assertCommutative(cover, expected, tip, staleView, candidates);
                resolution = Resolution.MERGED;
            }
            List<EventPage> pages = renumber(candidates, tip, false);
            try {
                appender.append(cover, pages);
                if (resolution == Resolution.MERGED) {
                    log.info("Merged stale write on {}: expected {}, committed at {}", cover.cacheKey(), expected, tip);
                }
                return new SequencingResult(committedBook(cover, pages), MergeStrategy.EXPLICIT, resolution, attempt);
            } catch (SequenceConflictException e) {
                log.debug("Explicit append raced on {} (attempt {}): {}", cover.cacheKey(), attempt, e.getMessage());
                if (attempt == config.maxAttempts()) {
                    throw new SequenceConflictException(expected, e.getActual(),
                        "Explicit write on " + cover.cacheKey() + " still conflicting after " + attempt + " attempts");
                }
                pause(attempt);
                tip = repository.nextSequence(cover);
            }
        }
        throw new IllegalStateException("unreachable");
    }

    private void assertCommutative(Cover cover, long expected, long tip, EventBook staleView, List<EventPage> candidates) {
        StateReconstructor<?> reconstructor = reconstructors.get(cover.domain());
        if (reconstructor == null) {
            throw new SequenceConflictException(expected, tip,
                "Sequence mismatch on " + cover.cacheKey() + ": expected " + expected + ", actual " + tip
                    + " (no state reconstructor for merge)");
        }
        EventBook committed = repository.load(cover);
        Set<FieldPath> overlap = overlap(reconstructor, staleView, committed, candidates);
        if (!overlap.isEmpty()) {
            throw new SequenceConflictException(expected, tip,
                "Sequence mismatch on " + cover.cacheKey() + ": expected " + expected + ", actual " + tip
                    + "; conflicting fields " + overlap);
        }
    }

    private <S> Set<FieldPath> overlap(
        StateReconstructor<S> reconstructor,
        EventBook staleView,
        EventBook committed,
        List<EventPage> candidates
    ) {
        S base = reconstructor.rebuild(staleView);
        S theirs = reconstructor.rebuild(committed);
        S mine = reconstructor.apply(base, candidates);

        Set<FieldPath> mineChanged = mergeAnalyzer.changedFields(base, mine);
        Set<FieldPath> theirsChanged = mergeAnalyzer.changedFields(base, theirs);
        if (MergeAnalyzer.areDisjoint(mineChanged, theirsChanged)) {
            return Set.of();
        }
        Set<FieldPath> overlap = new LinkedHashSet<>(mineChanged);
        overlap.retainAll(theirsChanged);
        return overlap;
    }

    // ========================================
    // AUTO_RESEQUENCE
    // ========================================

    private SequencingResult autoResequence(Cover cover, EventBook history, CandidateProducer producer) {
        EventBook view = history;
        boolean resequenced = false;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            if (attempt > 1 || repository.nextSequence(cover) != view.nextSequence()) {
                view = repository.load(cover);
                resequenced = true;
            }
            List<EventPage> candidates = producer.produce(view).pages();
            if (candidates.isEmpty()) {
                return new SequencingResult(emptyBook(cover, view.nextSequence()), MergeStrategy.AUTO_RESEQUENCE,
                    Resolution.NO_EVENTS, attempt);
            }
            List<EventPage> pages = renumber(candidates, view.nextSequence(), false);
            try {
                appender.append(cover, pages);
                return new SequencingResult(committedBook(cover, pages), MergeStrategy.AUTO_RESEQUENCE,
                    resequenced ? Resolution.RESEQUENCED : Resolution.DIRECT, attempt);
            } catch (SequenceConflictException e) {
                log.debug("AutoResequence conflict on {} at {} (attempt {}/{})",
                    cover.cacheKey(), view.nextSequence(), attempt, config.maxAttempts());
                if (attempt == config.maxAttempts()) {
                    log.warn("AutoResequence exhausted on {} after {} attempts", cover.cacheKey(), attempt);
                    throw new SequenceConflictException(view.nextSequence(), e.getActual(),
                        "AutoResequence on " + cover.cacheKey() + " exhausted after " + attempt + " attempts");
                }
                pause(attempt);
            }
        }
        throw new IllegalStateException("unreachable");
    }

    // ========================================
    // FORCE
    // ========================================

    private SequencingResult force(Cover cover, CommandPage page, EventBook history, CandidateProducer producer) {
        List<EventPage> candidates = producer.produce(history).pages();
        if (candidates.isEmpty()) {
            return new SequencingResult(emptyBook(cover, history.nextSequence()), MergeStrategy.FORCE,
                Resolution.NO_EVENTS, 0);
        }
        long start = page.hasSequence() ? page.sequence() : repository.nextSequence(cover);
        List<EventPage> pages = renumber(candidates, start, true);
        appender.append(cover, pages);
        log.warn("Forced write on {} at sequence {} ({} pages), contiguity not guaranteed",
            cover.cacheKey(), start, pages.size());
        return new SequencingResult(committedBook(cover, pages), MergeStrategy.FORCE, Resolution.FORCED, 1);
    }

    // ========================================
    // helpers
    // ========================================

    private static List<EventPage> renumber(List<EventPage> candidates, long start, boolean forced) {
        List<EventPage> pages = new ArrayList<>(candidates.size());
        long sequence = start;
        for (EventPage candidate : candidates) {
            EventPage page = candidate.withSequence(sequence++);
            pages.add(forced ? page.asForced() : page);
        }
        return pages;
    }

    private static EventBook committedBook(Cover cover, List<EventPage> pages) {
        return EventBook.of(cover, pages);
    }

    private static EventBook emptyBook(Cover cover, long nextSequence) {
        return new EventBook(cover, null, List.of(), nextSequence);
    }

    private void pause(int attempt) {
        try {
            sleeper.sleep(backoff.calculate(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfraException("Interrupted while waiting to retry append", e);
        }
    }
}
