package com.example.sidelight.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SidecarExportResponse {
    private String sourceFile;
    private boolean raw;
    private Map<String, String> files; // format -> written path
}
