package com.repo.coupling.parse;

import com.repo.coupling.model.ChangeStatus;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed status token such as {@code M} or {@code R087}.
 *
 * @param score similarity for renames/copies, dissimilarity for rewrites, -1 when absent
 */
record StatusToken(ChangeStatus status, int score) {

    // Renames and copies must carry a score; other letters may carry one (-B rewrites)
    private static final Pattern STATUS = Pattern.compile("^(?:([AMDTUXB])(\\d{1,3})?|([RC])(\\d{1,3}))$");

    static Optional<StatusToken> parse(String token) {
        Matcher m = STATUS.matcher(token);
        if (!m.matches()) {
            return Optional.empty();
        }
        String letter = m.group(1) != null ? m.group(1) : m.group(3);
        String digits = m.group(1) != null ? m.group(2) : m.group(4);
        int score = digits != null ? Integer.parseInt(digits) : -1;
        if (score > 100) {
            return Optional.empty();
        }
        return ChangeStatus.fromCode(letter.charAt(0)).map(status -> new StatusToken(status, score));
    }

    static boolean looksLikeStatus(String token) {
        return parse(token).isPresent();
    }
}
