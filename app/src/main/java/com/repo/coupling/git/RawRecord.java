package com.repo.coupling.git;

import java.util.List;

/**
 * Tokens of one commit block, without the leading commit marker.
 *
 * @param firstTokenPosition stream-wide index of {@code tokens.get(0)}
 * @param hasMarker          false only for garbage that preceded the first marker
 */
public record RawRecord(long firstTokenPosition, boolean hasMarker, List<String> tokens) {

    public RawRecord {
        tokens = List.copyOf(tokens);
    }
}
