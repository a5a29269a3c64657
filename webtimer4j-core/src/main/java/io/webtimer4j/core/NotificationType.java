package io.webtimer4j.core;

public enum NotificationType {
    FIRST_SUCCESS("first_success", true),
    RESPONSE_CHANGED("response_changed", true),
    SUCCESS_NO_CHANGE("success_no_change", true),
    FAILURE("failure", false),
    RECOVERY("recovery", true);

    private final String wireName;
    private final boolean successClass;

    NotificationType(String wireName, boolean successClass) {
        this.wireName = wireName;
        this.successClass = successClass;
    }

    /**
     * Value of {@code notification_type} in datagrams.
     */
    public String wireName() {
        return wireName;
    }

    public boolean successClass() {
        return successClass;
    }
}
