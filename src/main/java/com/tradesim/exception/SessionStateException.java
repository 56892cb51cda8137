package com.tradesim.exception;

import com.tradesim.domain.enums.SessionStatus;
import java.util.Map;

/** A lifecycle command that the session's current state does not allow. */
public class SessionStateException extends BaseException {

    public SessionStateException(String sessionId, SessionStatus status, String command) {
        super(
                ErrorCode.INVALID_STATE,
                String.format("Cannot %s session %s in state %s", command, sessionId, status),
                Map.of("sessionId", sessionId, "status", status.name()));
    }
}
