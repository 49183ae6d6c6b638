package com.storeforecast.store;

import lombok.experimental.UtilityClass;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pruning rule for archived model versions. Versions order by their {@code yyyyMMdd_HHmmss}
 * timestamp, then by the numeric same-second suffix, so {@code _2} precedes {@code _10}.
 */
@UtilityClass
public class HistoryRetention {

    private static final Pattern VERSION = Pattern.compile("^(\\d{8}_\\d{6})(?:_(\\d{1,9}))?$");

    /** Oldest first. Ids outside the timestamp format sort by plain string order after the rest. */
    public static final Comparator<String> CHRONOLOGICAL = HistoryRetention::compareVersions;

    /**
     * Versions to delete so that only {@code keep} archived versions remain. The current
     * version is never selected and does not count against {@code keep}.
     */
    public List<String> selectForDeletion(List<String> versions, String current, int keep) {
        return archived(versions, current).stream()
            .skip(Math.max(0, keep))
            .toList();
    }

    /** Archived versions, newest first. */
    public List<String> archived(List<String> versions, String current) {
        return versions.stream()
            .filter(v -> !v.equals(current))
            .distinct()
            .sorted(CHRONOLOGICAL.reversed())
            .toList();
    }

    private int compareVersions(String a, String b) {
        Matcher ma = VERSION.matcher(a);
        Matcher mb = VERSION.matcher(b);
        boolean aParsed = ma.matches();
        boolean bParsed = mb.matches();
        if (!aParsed || !bParsed) {
            if (aParsed != bParsed) {
                return aParsed ? -1 : 1;
            }
            return a.compareTo(b);
        }
        int byTimestamp = ma.group(1).compareTo(mb.group(1));
        if (byTimestamp != 0) {
            return byTimestamp;
        }
        return Integer.compare(suffix(ma), suffix(mb));
    }

    private int suffix(Matcher m) {
        return m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
    }
}
