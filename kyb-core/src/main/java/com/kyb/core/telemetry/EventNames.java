package com.kyb.core.telemetry;

/**
 * Event names emitted by the dashboard.
 */
public final class EventNames {

    public static final String DASHBOARD_LOADED = "DASHBOARD_LOADED";
    public static final String DASHBOARD_LOAD_FAILED = "DASHBOARD_LOAD_FAILED";
    public static final String CUSTOMER_SELECTED = "CUSTOMER_SELECTED";
    public static final String CUSTOMER_SELECTION_REJECTED = "CUSTOMER_SELECTION_REJECTED";

    public static final String KYB_RUN_STARTED = "KYB_RUN_STARTED";
    public static final String KYB_RUN_REJECTED = "KYB_RUN_REJECTED";
    public static final String WORKFLOW_STEP_COMPLETED = "WORKFLOW_STEP_COMPLETED";
    public static final String KYB_RUN_COMPLETED = "KYB_RUN_COMPLETED";
    public static final String KYB_DATA_FETCH_FAILED = "KYB_DATA_FETCH_FAILED";
    public static final String KYB_RUN_FAILED = "KYB_RUN_FAILED";
    public static final String KYB_RUN_CANCELLED = "KYB_RUN_CANCELLED";
    public static final String KYB_RUN_RESET = "KYB_RUN_RESET";
    public static final String NAVIGATION_SIGNALLED = "NAVIGATION_SIGNALLED";
    public static final String SAVE_RECENT_CHECK = "SAVE_RECENT_CHECK";

    public static final String API_KYB_RUN_REQUEST = "API_KYB_RUN_REQUEST";
    public static final String API_KYB_RUN_SUCCESS = "API_KYB_RUN_SUCCESS";
    public static final String API_KYB_RUN_FAILED = "API_KYB_RUN_FAILED";

    public static final String CUSTOMER_DETAIL_LOADED = "CUSTOMER_DETAIL_LOADED";
    public static final String RM_OVERRIDE_UPDATED = "RM_OVERRIDE_UPDATED";

    private EventNames() {
    }
}
