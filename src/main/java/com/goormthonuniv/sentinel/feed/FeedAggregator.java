package com.goormthonuniv.sentinel.feed;

import com.goormthonuniv.sentinel.dto.Signal;

import java.util.List;

/** 설정된 피드 전체에서 신호를 모은다. 피드 단위 실패는 결과에서 빠질 뿐 예외가 아니다. */
public interface FeedAggregator {
    List<Signal> fetchAll();
}
