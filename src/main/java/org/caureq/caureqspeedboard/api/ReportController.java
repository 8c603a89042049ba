package org.caureq.caureqspeedboard.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.caureqspeedboard.api.dto.ReportAck;
import org.caureq.caureqspeedboard.api.dto.ReportDTO;
import org.caureq.caureqspeedboard.service.IngestService;
import org.springframework.web.bind.annotation.*;

/** Node ingestion. The shared token is checked by TokenFilter before this runs. */
@RestController
@RequestMapping("/api/v1/report")
@RequiredArgsConstructor
public class ReportController {
    private final IngestService ingestService;

    @PostMapping
    public ReportAck report(@Valid @RequestBody ReportDTO body) {
        return ingestService.ingest(body);
    }
}
