package com.example.presence.shared.util;

/**
 * Provides compile-time safe constants for all SQL query keys
 * defined in the sql/queries.properties file.
 */
public final class SqlKeys {

    private SqlKeys() {}

    // ===============================================
    // duration_day_totals queries
    // ===============================================
    public static final String TOTALS_ADD_SECONDS = "totals.addSeconds";
    public static final String TOTALS_FIND_DAY_SECONDS = "totals.findDaySeconds";
    public static final String TOTALS_SUM_FOR_USER = "totals.sumForUser";
    public static final String TOTALS_SUM_BY_USER = "totals.sumByUser";
    public static final String TOTALS_FIND_TRACKED_DATES = "totals.findTrackedDates";
    public static final String TOTALS_COUNT = "totals.count";
    public static final String TOTALS_DELETE_ALL = "totals.deleteAll";

    // ===============================================
    // tracker_meta queries
    // ===============================================
    public static final String META_UPSERT = "meta.upsert";
    public static final String META_FIND = "meta.find";
    public static final String META_FIND_ALL = "meta.findAll";
    public static final String META_DELETE_TEMPLATE = "meta.delete.template";

    // ===============================================
    // compliment_choices queries
    // ===============================================
    public static final String COMPLIMENT_UPSERT = "compliment.upsert";
    public static final String COMPLIMENT_FIND = "compliment.find";
    public static final String COMPLIMENT_FIND_BY_PREFIX = "compliment.findByPrefix";
    public static final String COMPLIMENT_COUNT = "compliment.count";
    public static final String COMPLIMENT_DELETE_ALL = "compliment.deleteAll";

    // ===============================================
    // user_profiles queries
    // ===============================================
    public static final String PROFILE_UPSERT = "profile.upsert";
    public static final String PROFILE_FIND_BY_ID = "profile.findById";
    public static final String PROFILE_FIND_ALL = "profile.findAll";
}
