package com.rebenew.tandem.syncserver.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Body for create / join / end / sync requests: identifies the caller.
 */
@Setter
@Getter
public class SessionRequest {
    private String userId;

    public SessionRequest() {}

    public SessionRequest(String userId) {
        this.userId = userId;
    }
}
