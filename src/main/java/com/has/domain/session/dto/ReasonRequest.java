package com.has.domain.session.dto;

import lombok.Getter;
import lombok.Setter;

// 취소/거절 사유
@Getter
@Setter
public class ReasonRequest {
    private String reason;
}
