package com.streamfirst.olap.cooldown.ports;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-item outcome of a batch operation. Batches are not transactional: some items
 * may succeed while others fail, and callers retry the failed ones individually.
 *
 * @param succeeded remote paths that were written or deleted
 * @param failed remote paths that failed, with the error message
 */
public record BatchResult(List<String> succeeded, Map<String, String> failed) {
    public BatchResult {
        succeeded = List.copyOf(succeeded);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
