package com.acme.export.web;

import com.acme.export.core.ExportPhase;
import com.acme.export.core.ExportRun;
import com.acme.export.core.ExportSummary;

public record ExportStatus(String ownerId, ExportPhase phase, String startedAt, String error, ExportSummary summary) {

    public static ExportStatus of(ExportRun run) {
        return new ExportStatus(run.owner().ownerId(), run.phase(), run.startedAt().toString(), run.error(), run.summary());
    }
}
