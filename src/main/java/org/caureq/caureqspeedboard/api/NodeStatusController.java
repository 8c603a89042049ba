package org.caureq.caureqspeedboard.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqspeedboard.api.dto.ClusterStatusDTO;
import org.caureq.caureqspeedboard.service.AggregatorService;
import org.springframework.web.bind.annotation.*;

/**
 * Read-only aggregated state for operators (token protected).
 */
@RestController
@RequestMapping("/api/v1/nodes")
@RequiredArgsConstructor
public class NodeStatusController {
    private final AggregatorService aggregator;

    @GetMapping
    public ClusterStatusDTO all() { return ClusterStatusDTO.from(aggregator.buildView()); }
}
