package com.repo.coupling.parse;

/**
 * States of the record parser. Every token moves the machine along exactly one transition.
 */
enum ParseState {
    /** Collecting the fixed metadata fields after the commit marker. */
    EXPECT_METADATA,
    /** Between file entries: only a status token is valid. */
    EXPECT_STATUS,
    /** After a single-path status. */
    EXPECT_PATH,
    /** After a rename/copy status: the source path. */
    EXPECT_OLD_PATH,
    /** After the source path: the destination path. */
    EXPECT_NEW_PATH
}
