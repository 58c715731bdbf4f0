package com.example.sidelight.service;

import com.example.sidelight.dto.SidecarExportResponse;
import com.example.sidelight.dto.SidecarRequest;
import com.example.sidelight.dto.SidecarResponse;

import java.io.IOException;

public interface SidecarService {

    /**
     * Compile the request's grading parameters into sidecar documents, in memory.
     * @throws IllegalArgumentException when the request carries nothing to grade or names an
     *                                  unknown or unsatisfiable format
     */
    SidecarResponse compile(SidecarRequest request);

    /**
     * Compile and write {@code <basename>.<format>} files into the configured output directory.
     */
    SidecarExportResponse export(SidecarRequest request) throws IOException;
}
