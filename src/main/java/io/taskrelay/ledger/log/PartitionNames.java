package io.taskrelay.ledger.log;

import io.taskrelay.ledger.constant.LedgerConstant;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Maps task ids to file-system safe partition directory names and back.
 */
final class PartitionNames {
    private static final HexFormat HEX = HexFormat.of();

    private PartitionNames() {
    }

    static String directoryName(final String taskId) {
        return LedgerConstant.PARTITION_DIR_PREFIX + HEX.formatHex(taskId.getBytes(StandardCharsets.UTF_8));
    }

    static Optional<String> taskIdOf(final String directoryName) {
        if (!directoryName.startsWith(LedgerConstant.PARTITION_DIR_PREFIX)) return Optional.empty();
        try {
            final byte[] raw = HEX.parseHex(directoryName.substring(LedgerConstant.PARTITION_DIR_PREFIX.length()));
            return Optional.of(new String(raw, StandardCharsets.UTF_8));
        } catch (final IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
