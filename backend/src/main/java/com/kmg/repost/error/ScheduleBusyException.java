package com.kmg.repost.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when a schedule is asked to run while another execution of it still holds its lease.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ScheduleBusyException extends RuntimeException {
    public ScheduleBusyException(String scheduleId) {
        super("Schedule is already running: " + scheduleId);
    }
}
