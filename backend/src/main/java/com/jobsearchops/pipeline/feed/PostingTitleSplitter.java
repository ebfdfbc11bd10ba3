package com.jobsearchops.pipeline.feed;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits job-board titles such as {@code "Analytics Manager at Acme"}, {@code "Data Manager | Acme"}
 * or {@code "BI Manager - Acme"} into role and company.
 */
public final class PostingTitleSplitter {
    public static final String UNKNOWN_COMPANY = "Unknown";

    private static final String[] WORD_SEPARATORS = {" at ", " @ "};
    private static final Pattern PUNCTUATION_SEPARATOR = Pattern.compile("^(.+?)\\s*[|\\u2013\\u2014-]\\s*(.+)$");

    private PostingTitleSplitter() {
    }

    public static RoleAndCompany split(String rawTitle) {
        String raw = rawTitle == null ? "" : rawTitle.trim();
        String lower = raw.toLowerCase(Locale.ROOT);
        for (String separator : WORD_SEPARATORS) {
            int idx = lower.indexOf(separator);
            if (idx >= 0) {
                return of(raw, raw.substring(0, idx), raw.substring(idx + separator.length()));
            }
        }
        Matcher matcher = PUNCTUATION_SEPARATOR.matcher(raw);
        if (matcher.matches()) {
            return of(raw, matcher.group(1), matcher.group(2));
        }
        return of(raw, raw, "");
    }

    private static RoleAndCompany of(String raw, String role, String company) {
        String cleanRole = role.trim();
        String cleanCompany = company.trim();
        return new RoleAndCompany(
            cleanRole.isEmpty() ? raw : cleanRole,
            cleanCompany.isEmpty() ? UNKNOWN_COMPANY : cleanCompany
        );
    }

    public record RoleAndCompany(String roleTitle, String company) {
    }
}
