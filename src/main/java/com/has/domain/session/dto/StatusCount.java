package com.has.domain.session.dto;

// 상태별 세션 수 (GROUP BY status 쿼리용)
public interface StatusCount {
    String getStatus();
    long getCount();
}
