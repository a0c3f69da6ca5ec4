package io.peerbench.bank.ffiec;

import java.io.IOException;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Extracts {@link BulkFields#TARGET_FIELDS} from a downloaded bulk archive.
 */
public interface ArchiveParser {
    List<BulkObservation> parse(byte[] archive, IntPredicate certFilter) throws IOException;
}
