/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.dto.LoadDiagnosticsDTO;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Writes every load report to the log as a single JSON line.
 */
@ApplicationScoped
public class DiagnosticsLogger {

    private static final Logger LOG = Logger.getLogger(DiagnosticsLogger.class);

    private final ObjectMapper objectMapper;

    @Inject
    public DiagnosticsLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    void onLoad(@Observes LoadDiagnosticsDTO diagnostics) {
        if (diagnostics.skippedRows() > 0 || !diagnostics.notes().isEmpty()) {
            LOG.warnf("Load completed with %d skipped rows and %d notes",
                    diagnostics.skippedRows(), diagnostics.notes().size());
        }
        LOG.info(render(diagnostics));
    }

    String render(LoadDiagnosticsDTO diagnostics) {
        try {
            return "Load diagnostics: " + objectMapper.writeValueAsString(diagnostics);
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Could not serialize load diagnostics");
            return "Load diagnostics: " + diagnostics;
        }
    }
}
