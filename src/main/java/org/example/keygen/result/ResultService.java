package org.example.keygen.result;

import org.example.keygen.model.ResultRecord;
import org.example.keygen.store.ResultStore;
import org.springframework.stereotype.Service;

/**
 * Read-only view of the result store used by polling clients.
 */
@Service
public class ResultService {

    private final ResultStore resultStore;

    public ResultService(ResultStore resultStore) {
        this.resultStore = resultStore;
    }

    public ResultRecord lookup(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new ResultNotFoundException(requestId);
        }
        return resultStore.find(requestId.trim())
                .orElseThrow(() -> new ResultNotFoundException(requestId));
    }
}
