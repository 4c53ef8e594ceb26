package com.example.hybridretrieval.controller;

import com.example.hybridretrieval.application.service.RagApplicationService;
import com.example.hybridretrieval.domain.dto.ContextResponse;
import com.example.hybridretrieval.domain.dto.IngestRequest;
import com.example.hybridretrieval.domain.dto.ResponseData;
import com.example.hybridretrieval.domain.dto.RetrievalRequest;
import com.example.hybridretrieval.domain.dto.RetrievalResponse;
import com.example.hybridretrieval.infrastructure.ingest.IngestService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/rag")
public class RagController {

    private final RagApplicationService ragApplicationService;

    public RagController(RagApplicationService ragApplicationService) {
        this.ragApplicationService = ragApplicationService;
    }

    @PostMapping(path = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<RetrievalResponse>> search(@Valid @RequestBody RetrievalRequest request) {
        RetrievalResponse result = ragApplicationService.search(request);
        String message = result.isDegraded() ? "Search completed with degraded channels" : "Search completed";
        return ResponseEntity.ok(ResponseData.ok(message, result));
    }

    @PostMapping(path = "/context", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<ContextResponse>> context(@Valid @RequestBody RetrievalRequest request) {
        return ResponseEntity.ok(ResponseData.ok("Context built", ragApplicationService.context(request)));
    }

    @PostMapping(path = "/ingest", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<IngestService.IngestResult>> ingest(
            @RequestBody(required = false) IngestRequest request
    ) {
        String directory = request == null ? null : request.getDirectory();
        return created(ragApplicationService.ingestDirectory(directory));
    }

    @PostMapping(
            path = "/ingest/file",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<IngestService.IngestResult>> ingestFile(@RequestPart("file") MultipartFile file) {
        return created(ragApplicationService.ingestFile(file));
    }

    @GetMapping(path = "/index/count", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<Map<String, Long>>> count() {
        return ResponseEntity.ok(ResponseData.ok("Index count", Map.of("count", ragApplicationService.indexCount())));
    }

    @PutMapping(path = "/index", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<Void>> prepareIndex(
            @RequestParam(name = "recreate", defaultValue = "false") boolean recreate
    ) {
        ragApplicationService.prepareIndex(recreate);
        return ResponseEntity.ok(ResponseData.<Void>ok(recreate ? "Index recreated" : "Index ready", null));
    }

    private static ResponseEntity<ResponseData<IngestService.IngestResult>> created(IngestService.IngestResult result) {
        String message = result.failed() == 0
                ? "Ingest completed"
                : "Ingest completed with " + result.failed() + " failed chunks";
        return ResponseEntity.status(HttpStatus.CREATED).body(ResponseData.of(HttpStatus.CREATED, message, result));
    }
}
