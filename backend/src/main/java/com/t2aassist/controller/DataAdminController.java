package com.t2aassist.controller;

import com.t2aassist.engine.snapshot.DataSnapshot;
import com.t2aassist.service.SnapshotLoaderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for reference data administration.
 */
@RestController
@RequestMapping("/api/data")
@RequiredArgsConstructor
@Slf4j
public class DataAdminController {

    private final SnapshotLoaderService loaderService;

    /**
     * Reload the catalog and compatibility graph after the ingestion pipeline ran.
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        log.info("Reference data reload requested");
        DataSnapshot snapshot = loaderService.reload();
        return ResponseEntity.ok(Map.of(
            "dataVersion", snapshot.version(),
            "versionLabel", snapshot.label(),
            "codes", snapshot.catalog().size(),
            "associations", snapshot.graph().associations().size(),
            "incompatibilities", snapshot.graph().incompatibilities().size()
        ));
    }
}
