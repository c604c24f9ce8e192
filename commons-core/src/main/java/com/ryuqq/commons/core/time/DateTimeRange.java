package com.ryuqq.commons.core.time;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Optional;

/**
 * 로컬 날짜/시간 구간 (양 끝 포함).
 *
 * <p>start == end인 구간은 시점(time point)입니다.</p>
 *
 * <p><strong>겹침 판단:</strong> 겹치는 구간의 길이가 0보다 커야 하며, 최소 겹침 시간이 주어지면
 * 그 이상이어야 합니다. 끝과 시작이 맞닿기만 한 구간은 겹치지 않습니다.</p>
 *
 * @param start 시작 (포함)
 * @param end 끝 (포함, start 이후)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DateTimeRange(
    LocalDateTime start,
    LocalDateTime end
) {

    /**
     * 구간 길이 순 정렬.
     */
    public static final Comparator<DateTimeRange> BY_DURATION = Comparator.comparing(DateTimeRange::duration);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException start/end가 null이거나 start가 end 이후인 경우
     */
    public DateTimeRange {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        if (end == null) {
            throw new IllegalArgumentException("end cannot be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                "start must not be after end (start: " + start + ", end: " + end + ")"
            );
        }
    }

    public static DateTimeRange of(LocalDateTime start, LocalDateTime end) {
        return new DateTimeRange(start, end);
    }

    public boolean isTimePoint() {
        return start.equals(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public LocalDateTime middle() {
        return start.plus(duration().dividedBy(2));
    }

    /**
     * 양 끝을 같은 시간만큼 이동한 새 구간.
     *
     * @param amount 이동 시간 (음수 가능)
     * @return 새 DateTimeRange
     */
    public DateTimeRange plus(Duration amount) {
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
        return new DateTimeRange(start.plus(amount), end.plus(amount));
    }

    public boolean contains(LocalDateTime value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return !value.isBefore(start) && !value.isAfter(end);
    }

    public boolean contains(DateTimeRange other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public boolean overlaps(DateTimeRange other) {
        return overlaps(other, Duration.ZERO);
    }

    /**
     * 최소 겹침 시간 이상 겹치는지 확인.
     *
     * @param other 대상 구간
     * @param minimumOverlap 최소 겹침 시간
     * @return 겹치는 길이가 0보다 크고 minimumOverlap 이상이면 true
     * @throws IllegalArgumentException other 또는 minimumOverlap이 null인 경우
     */
    public boolean overlaps(DateTimeRange other, Duration minimumOverlap) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (minimumOverlap == null) {
            throw new IllegalArgumentException("minimumOverlap cannot be null");
        }
        LocalDateTime overlapStart = start.isAfter(other.start) ? start : other.start;
        LocalDateTime overlapEnd = end.isBefore(other.end) ? end : other.end;
        return overlapStart.isBefore(overlapEnd)
            && Duration.between(overlapStart, overlapEnd).compareTo(minimumOverlap) >= 0;
    }

    public Optional<DateTimeRange> intersection(DateTimeRange other) {
        return intersection(other, Duration.ZERO);
    }

    /**
     * 겹치는 구간 계산.
     *
     * @param other 대상 구간
     * @param minimumOverlap 최소 겹침 시간
     * @return 겹치는 구간, {@link #overlaps(DateTimeRange, Duration)}가 false면 empty
     */
    public Optional<DateTimeRange> intersection(DateTimeRange other, Duration minimumOverlap) {
        if (!overlaps(other, minimumOverlap)) {
            return Optional.empty();
        }
        LocalDateTime overlapStart = start.isAfter(other.start) ? start : other.start;
        LocalDateTime overlapEnd = end.isBefore(other.end) ? end : other.end;
        return Optional.of(new DateTimeRange(overlapStart, overlapEnd));
    }
}
