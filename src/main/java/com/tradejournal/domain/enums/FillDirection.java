package com.tradejournal.domain.enums;

/**
 * Direction of a fill relative to the account's position, derived once from the venue's
 * free-text direction tag ("Open Long", "Close Short", ...).
 *
 * <p>Tags that start with neither "Open" nor "Close" (empty tags, flip tags such as
 * "Long &gt; Short", or anything malformed) classify as UNKNOWN and are resolved from the
 * position snapshot instead.
 */
public enum FillDirection {
    OPEN,
    CLOSE,
    UNKNOWN;

    public static FillDirection fromTag(String tag) {
        if (tag == null) {
            return UNKNOWN;
        }
        if (tag.startsWith("Open")) {
            return OPEN;
        }
        if (tag.startsWith("Close")) {
            return CLOSE;
        }
        return UNKNOWN;
    }
}
