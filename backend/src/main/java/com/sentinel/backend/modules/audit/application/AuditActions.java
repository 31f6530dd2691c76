package com.sentinel.backend.modules.audit.application;

/**
 * Action tags written by call sites.
 */
public final class AuditActions {

    public static final String LOGIN = "login";
    public static final String LOGIN_FAILED = "login_failed";
    public static final String LOGOUT = "logout";
    public static final String PASSWORD_CHANGED = "password_changed";
    public static final String ACCOUNT_CREATED = "account_created";
    public static final String ACCOUNT_UPDATED = "account_updated";
    public static final String ACCOUNT_DEACTIVATED = "account_deactivated";
    public static final String ACCOUNT_DELETED = "account_deleted";
    public static final String IDENTITY_CREATED = "identity_created";
    public static final String IDENTITY_RETURNING = "identity_returning";
    public static final String DEVICE_REGISTERED = "device_registered";

    private AuditActions() {
    }
}
