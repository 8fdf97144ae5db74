package io.taskrelay.ledger.constant;

/**
 * Shared constants for ledger segment files.
 */
public final class LedgerConstant {
    /**
     * File extension for segment files.
     */
    public static final String SEGMENT_EXT = ".seg";

    /**
     * 0x54524C59 == 'T' 'R' 'L' 'Y'
     */
    public static final int MAGIC = 0x5452_4C59;
    public static final short VERSION = 1;

    /**
     * Sequence a partition reports before its first append. The first event gets {@code NO_SEQUENCE + 1}.
     */
    public static final long NO_SEQUENCE = 0L;

    /**
     * Prefix of a partition directory; the rest of the name is the hex-encoded UTF-8 task id.
     */
    public static final String PARTITION_DIR_PREFIX = "p-";

    private LedgerConstant() {
        // Prevent instantiation
    }
}
