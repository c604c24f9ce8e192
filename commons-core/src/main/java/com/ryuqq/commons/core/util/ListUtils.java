package com.ryuqq.commons.core.util;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * List 검사 유틸리티.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ListUtils {

    private ListUtils() {
    }

    /**
     * index가 list의 유효한 위치인지 확인.
     *
     * @param list 대상 list
     * @param index 확인할 index
     * @return 0 이상 size 미만이면 true
     * @throws IllegalArgumentException list가 null인 경우
     */
    public static boolean isIndexValid(List<?> list, int index) {
        requireList(list);
        return index >= 0 && index < list.size();
    }

    /**
     * 모든 요소가 서로 다른지 확인 (equals 기준, null 요소 허용).
     *
     * @param list 대상 list
     * @param <T> 요소 타입
     * @return 중복이 없으면 true
     */
    public static <T> boolean isUnique(List<T> list) {
        return isUniqueBy(list, Function.identity());
    }

    /**
     * keyExtractor로 뽑은 키가 모두 서로 다른지 확인.
     *
     * @param list 대상 list
     * @param keyExtractor 키 추출 함수
     * @param <T> 요소 타입
     * @param <K> 키 타입
     * @return 중복 키가 없으면 true
     * @throws IllegalArgumentException list 또는 keyExtractor가 null인 경우
     */
    public static <T, K> boolean isUniqueBy(List<T> list, Function<? super T, ? extends K> keyExtractor) {
        requireList(list);
        if (keyExtractor == null) {
            throw new IllegalArgumentException("keyExtractor cannot be null");
        }
        Set<K> seen = new HashSet<>();
        for (T element : list) {
            if (!seen.add(keyExtractor.apply(element))) {
                return false;
            }
        }
        return true;
    }

    private static void requireList(List<?> list) {
        if (list == null) {
            throw new IllegalArgumentException("list cannot be null");
        }
    }
}
