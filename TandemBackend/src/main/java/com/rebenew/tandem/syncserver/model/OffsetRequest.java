package com.rebenew.tandem.syncserver.model;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class OffsetRequest {
    private String userId;
    private Long offsetMs;

    public OffsetRequest() {}

    public OffsetRequest(String userId, Long offsetMs) {
        this.userId = userId;
        this.offsetMs = offsetMs;
    }
}
