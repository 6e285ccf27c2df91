package com.example.presence.shared.util;

import java.util.List;

public final class Constants {

    private Constants() {}

    public static final String EXPORT_SOURCE = "tracker";

    public static final class MetaKeys {
        private MetaKeys() {}
        public static final String ANCHOR_DATE = "anchor_date";
        public static final String LAST_POST_DATE = "last_post_date";
        public static final String GROUP_KEY = "group_key";
        public static final String GROUP_SINCE = "group_since";

        /** Keys wiped on a reset; group_key survives a hard reset and is rewritten on a group change. */
        public static final List<String> TIMING_KEYS = List.of(LAST_POST_DATE, ANCHOR_DATE, GROUP_SINCE);
    }

    public enum Scope {
        DAY("day"),
        WEEK("week"),
        MONTH("month");

        private final String key;

        Scope(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        /** Prefix of the compliment memo key for periods of this scope. */
        public String periodPrefix() {
            return key + ":";
        }
    }
}
