package org.example.keygen.api;

import org.example.keygen.deadletter.DeadLetterEntry;
import org.example.keygen.deadletter.DeadLetterQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

// Operator view of jobs that exhausted their deliveries
@RestController
public class DeadLetterController {

    private final DeadLetterQueryService deadLetterQueryService;

    public DeadLetterController(DeadLetterQueryService deadLetterQueryService) {
        this.deadLetterQueryService = deadLetterQueryService;
    }

    @GetMapping("/admin/dead-letters")
    public List<DeadLetterEntry> deadLetters() {
        return deadLetterQueryService.listEntries();
    }
}
