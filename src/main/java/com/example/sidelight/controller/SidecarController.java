package com.example.sidelight.controller;

import com.example.sidelight.dto.SidecarExportResponse;
import com.example.sidelight.dto.SidecarRequest;
import com.example.sidelight.dto.SidecarResponse;
import com.example.sidelight.service.SidecarService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping(value = "/api/sidecars", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class SidecarController {

    private final SidecarService sidecarService;

    // ===================== COMPILE (IN MEMORY) =====================
    @PostMapping("/compile")
    public ResponseEntity<?> compile(@Valid @RequestBody SidecarRequest request) {
        try {
            SidecarResponse response = sidecarService.compile(request);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(Map.of("message", e.getMessage()));
        }
    }

    // ===================== EXPORT TO DISK =====================
    @PostMapping("/export")
    public ResponseEntity<?> export(@Valid @RequestBody SidecarRequest request) {
        try {
            SidecarExportResponse response = sidecarService.export(request);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(Map.of("message", e.getMessage()));
        } catch (IOException e) {
            log.error("Failed to write sidecars for {}", request.getSourceFile(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("message", "Failed to write sidecar files: " + e.getMessage()));
        }
    }
}
