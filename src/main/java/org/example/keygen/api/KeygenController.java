package org.example.keygen.api;

import org.example.keygen.model.ResultRecord;
import org.example.keygen.result.ResultService;
import org.example.keygen.submission.SubmissionReceipt;
import org.example.keygen.submission.SubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
public class KeygenController {

    private static final Logger logger = LoggerFactory.getLogger(KeygenController.class);

    private final SubmissionService submissionService;
    private final ResultService resultService;

    public KeygenController(SubmissionService submissionService, ResultService resultService) {
        this.submissionService = submissionService;
        this.resultService = resultService;
    }

    @PostMapping("/keygen")
    public ResponseEntity<SubmissionResponse> submit(@RequestBody(required = false) KeygenRequest request) {
        logger.info("get keygen request");
        KeygenRequest body = request != null ? request : new KeygenRequest(null, null);

        SubmissionReceipt receipt = submissionService.submit(body.keyType(), body.keyBits());
        return ResponseEntity.accepted()
                .location(URI.create("/result/" + receipt.requestId()))
                .body(new SubmissionResponse(receipt.requestId(), receipt.status()));
    }

    @GetMapping("/result/{requestId}")
    public ResultResponse result(@PathVariable String requestId) {
        ResultRecord record = resultService.lookup(requestId);
        return ResultResponse.from(record);
    }
}
