package io.webtimer4j.core;

public class DuplicateIdException extends WebTimerException {

    private final String scheduleId;

    public DuplicateIdException(String scheduleId) {
        super("Schedule already exists: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public String scheduleId() {
        return scheduleId;
    }
}
