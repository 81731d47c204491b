package com.acme.export.web;

import com.acme.export.config.ExportConfig;
import com.acme.export.core.ExportRun;
import com.acme.export.core.Jsons;
import com.acme.export.core.OwnerContext;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Controller("/exports")
public class ExportController {
    private final ExportRegistry registry;
    private final ExportConfig config;

    public ExportController(ExportRegistry registry, ExportConfig config) {
        this.registry = registry;
        this.config = config;
    }

    @Post("/{ownerId}")
    public HttpResponse<?> start(@PathVariable String ownerId, @Body @Nullable String payload) {
        ExportRun run;
        try {
            var owner = OwnerContext.of(ownerId);
            var request = payload == null || payload.isBlank()
                    ? new ExportRequest(null, null, null)
                    : Jsons.fromJson(payload, ExportRequest.class);
            run = registry.start(owner, request.concurrencyOr(config.getConcurrency()), request.overrides());
        } catch (ExportAlreadyRunningException e) {
            return HttpResponse.status(HttpStatus.CONFLICT).body(Jsons.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return HttpResponse.badRequest(Jsons.of("error", e.getMessage()));
        } catch (RuntimeException e) {
            return HttpResponse.badRequest(Jsons.of("error", "Malformed export request"));
        }

        // Wait briefly so small exports answer synchronously
        try {
            run.completion().get(config.getSyncWaitMillis(), TimeUnit.MILLISECONDS);
            return HttpResponse.ok(Jsons.toJson(ExportStatus.of(run)));
        } catch (TimeoutException e) {
            return accepted(run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return accepted(run);
        } catch (ExecutionException e) {
            return HttpResponse.serverError(Jsons.toJson(ExportStatus.of(run)));
        }
    }

    @Get("/{ownerId}")
    public HttpResponse<?> status(@PathVariable String ownerId) {
        try {
            return registry.find(OwnerContext.of(ownerId))
                    .<HttpResponse<?>>map(run -> HttpResponse.ok(Jsons.toJson(ExportStatus.of(run))))
                    .orElseGet(HttpResponse::notFound);
        } catch (IllegalArgumentException e) {
            return HttpResponse.badRequest(Jsons.of("error", e.getMessage()));
        }
    }

    @Delete("/{ownerId}")
    public HttpResponse<?> cancel(@PathVariable String ownerId) {
        try {
            if (registry.cancel(OwnerContext.of(ownerId))) {
                return HttpResponse.accepted();
            }
            return HttpResponse.notFound();
        } catch (IllegalArgumentException e) {
            return HttpResponse.badRequest(Jsons.of("error", e.getMessage()));
        }
    }

    private static HttpResponse<?> accepted(ExportRun run) {
        return HttpResponse.accepted()
                .header("X-Export-Owner", run.owner().ownerId())
                .body(Jsons.toJson(ExportStatus.of(run)));
    }
}
