package com.streamroom.backend.modules.session.application;

import java.util.regex.Pattern;

import com.streamroom.backend.global.error.ErrorCode;
import com.streamroom.backend.global.error.ProblemException;

/**
 * Shape checks for everything entering through the session gateway.
 */
public final class SessionInputValidator {

    private static final Pattern ROOM_ID = Pattern.compile("^[A-Za-z0-9_-]{1,100}$");
    private static final Pattern IDENTITY = Pattern.compile("^[A-Za-z0-9_ -]{1,50}$");
    private static final int MAX_JOB_ID_LENGTH = 100;

    private SessionInputValidator() {
    }

    public static boolean isValidRoomId(String roomId) {
        return roomId != null && ROOM_ID.matcher(roomId).matches();
    }

    public static boolean isValidIdentity(String identity) {
        return identity != null && IDENTITY.matcher(identity).matches();
    }

    public static String requireRoomId(String roomId) {
        if (!isValidRoomId(roomId)) {
            throw new ProblemException(ErrorCode.INVALID_ROOM_ID);
        }
        return roomId;
    }

    public static String requireIdentity(String identity) {
        if (!isValidIdentity(identity)) {
            throw new ProblemException(ErrorCode.INVALID_IDENTITY);
        }
        return identity;
    }

    public static String requireJobId(String jobId) {
        if (jobId == null || jobId.isBlank() || jobId.length() > MAX_JOB_ID_LENGTH) {
            throw new ProblemException(ErrorCode.INVALID_JOB_ID);
        }
        return jobId;
    }
}
