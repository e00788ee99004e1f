package org.logkeeper.ingest.utils;

import org.logkeeper.ingest.api.events.EventOrigin;
import org.logkeeper.ingest.api.events.IngestEvent;

import java.time.Instant;
import java.util.Comparator;

/**
 * Ordering of event positions used for checkpoint monotonicity and last-write-wins.
 * <p>
 * Ids are compared numerically when both are decimal strings (snowflake ids grow with time),
 * otherwise lexicographically.
 */
public final class EventOrdering {

    /**
     * Compares ids. A {@code null} id sorts before every other id.
     */
    public static final Comparator<String> ID_ORDER = EventOrdering::compareIds;

    private EventOrdering() {
        // Utility class
    }

    public static int compareIds(String a, String b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (isDecimal(a) && isDecimal(b)) {
            String left = stripLeadingZeros(a);
            String right = stripLeadingZeros(b);
            if (left.length() != right.length()) {
                return Integer.compare(left.length(), right.length());
            }
            return left.compareTo(right);
        }
        return a.compareTo(b);
    }

    /**
     * Compares two (timestamp, id) positions. The timestamp decides, the id breaks ties.
     * A {@code null} timestamp sorts first.
     */
    public static int comparePositions(Instant atA, String idA, Instant atB, String idB) {
        if (atA == null || atB == null) {
            if (atA != atB) {
                return atA == null ? -1 : 1;
            }
        } else {
            int byTime = atA.compareTo(atB);
            if (byTime != 0) {
                return byTime;
            }
        }
        return compareIds(idA, idB);
    }

    private static boolean isDecimal(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String s) {
        int i = 0;
        while (i < s.length() - 1 && s.charAt(i) == '0') {
            i++;
        }
        return s.substring(i);
    }

    /**
     * Last-write-wins rule. A newer version timestamp wins. On equal timestamps a live version
     * beats a backfilled one, and otherwise the later write wins.
     *
     * @param incoming The version being written.
     * @param stored   The version currently stored.
     * @return {@code true} if {@code incoming} should replace {@code stored}.
     */
    public static boolean supersedes(IngestEvent incoming, IngestEvent stored) {
        int byVersion = incoming.versionAt().compareTo(stored.versionAt());
        if (byVersion != 0) {
            return byVersion > 0;
        }
        return !(incoming.origin() == EventOrigin.BACKFILL && stored.origin() == EventOrigin.LIVE);
    }
}
