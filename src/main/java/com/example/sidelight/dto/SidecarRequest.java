package com.example.sidelight.dto;

import com.example.sidelight.validator.SupportedImageFile;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SidecarRequest {

    @SupportedImageFile
    private String sourceFile;   // name of the photo the sidecar belongs to

    private Boolean raw;         // null = decide from the extension of sourceFile

    private List<String> formats; // pp3, rt, xmp, all

    private String preset;       // replaces the native parameters completely when it resolves

    private ConsumerParameterSet consumer;

    @JsonProperty("native")
    private NativeParameterSet nativeParams;
}
