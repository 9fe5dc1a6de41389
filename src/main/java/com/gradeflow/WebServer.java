package com.gradeflow;

import akka.http.javadsl.Http;
import akka.http.javadsl.ServerBinding;
import akka.http.javadsl.marshallers.jackson.Jackson;
import akka.http.javadsl.model.StatusCodes;
import akka.http.javadsl.server.AllDirectives;
import akka.http.javadsl.server.PathMatchers;
import akka.http.javadsl.server.Route;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.SubmissionRequest;
import com.gradeflow.utils.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * HTTP control surface over {@link GradingService}
 *
 * <pre>
 * POST /jobs                 start a job, body: {"submissions": [...], "rubric": {...}, "strictness": 0.5}
 * POST /jobs/{id}/cancel     request cancellation
 * GET  /jobs/{id}            progress
 * GET  /jobs/{id}/report     report, once the job is terminal
 * </pre>
 */
public class WebServer extends AllDirectives {
    private static final Logger logger = LoggerFactory.getLogger(WebServer.class);

    private final GradingService service;
    private final ObjectMapper objectMapper;

    public WebServer(GradingService service) {
        this.service = service;
        this.objectMapper = JsonUtils.createObjectMapper();
    }

    public static void main(String[] args) {
        GradingService service = GradingService.create();
        GradingSettings settings = service.getSettings();
        try {
            WebServer server = new WebServer(service);
            server.startServer(settings.getHttpHost(), settings.getHttpPort())
                    .toCompletableFuture().join();
            logger.info("Press Ctrl+C to stop the server");
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.info("Server interrupted, shutting down");
            Thread.currentThread().interrupt();
            service.close();
        } catch (RuntimeException e) {
            logger.error("Failed to start server: {}", e.getMessage(), e);
            service.close();
        }
    }

    public CompletionStage<ServerBinding> startServer(String host, int port) {
        final Http http = Http.get(service.getSystem());

        return http.newServerAt(host, port)
                .bind(createRoute())
                .thenApply(binding -> {
                    logger.info("Server online at http://{}:{}/", host, port);
                    return binding;
                });
    }

    Route createRoute() {
        return pathPrefix("jobs", () -> concat(
                pathEnd(() ->
                        post(() ->
                                entity(Jackson.unmarshaller(objectMapper, StartJobRequest.class), request -> {
                                    if (request.submissions == null) {
                                        return complete(StatusCodes.BAD_REQUEST, error("submissions are required"),
                                                Jackson.marshaller(objectMapper));
                                    }
                                    double strictness = request.strictness != null
                                            ? request.strictness
                                            : service.getSettings().getDefaultStrictness();
                                    logger.info("Received job with {} submissions", request.submissions.size());
                                    return onSuccess(service.startJob(request.submissions, request.rubric, strictness),
                                            jobId -> complete(StatusCodes.ACCEPTED, Map.of("jobId", jobId),
                                                    Jackson.marshaller(objectMapper)));
                                })
                        )
                ),
                pathPrefix(PathMatchers.segment(), jobId -> concat(
                        pathEnd(() ->
                                get(() ->
                                        onSuccess(service.status(jobId), progress -> progress
                                                .<Route>map(p -> complete(StatusCodes.OK, p, Jackson.marshaller(objectMapper)))
                                                .orElseGet(() -> notFound(jobId)))
                                )
                        ),
                        path("cancel", () ->
                                post(() ->
                                        onSuccess(service.cancelJob(jobId), accepted -> accepted
                                                ? complete(StatusCodes.ACCEPTED, Map.<String, Object>of("jobId", jobId, "cancelRequested", true),
                                                Jackson.marshaller(objectMapper))
                                                : complete(StatusCodes.CONFLICT, error("Job " + jobId + " is unknown or already finished"),
                                                Jackson.marshaller(objectMapper)))
                                )
                        ),
                        path("report", () ->
                                get(() ->
                                        onSuccess(service.getReport(jobId), report -> report
                                                .<Route>map(r -> complete(StatusCodes.OK, r, Jackson.marshaller(objectMapper)))
                                                .orElseGet(() -> onSuccess(service.status(jobId), progress -> progress
                                                        .<Route>map(p -> complete(StatusCodes.ACCEPTED, p, Jackson.marshaller(objectMapper)))
                                                        .orElseGet(() -> notFound(jobId)))))
                                )
                        )
                ))
        ));
    }

    private Route notFound(String jobId) {
        return complete(StatusCodes.NOT_FOUND, error("Unknown job: " + jobId), Jackson.marshaller(objectMapper));
    }

    private static Map<String, String> error(String message) {
        return Map.of("error", message);
    }

    /**
     * Body of {@code POST /jobs}
     */
    public static class StartJobRequest {
        private final List<SubmissionRequest> submissions;
        private final RubricDefinition rubric;
        private final Double strictness;

        @JsonCreator
        public StartJobRequest(
                @JsonProperty("submissions") List<SubmissionRequest> submissions,
                @JsonProperty("rubric") RubricDefinition rubric,
                @JsonProperty("strictness") Double strictness) {
            this.submissions = submissions;
            this.rubric = rubric;
            this.strictness = strictness;
        }

        public List<SubmissionRequest> getSubmissions() { return submissions; }
        public RubricDefinition getRubric() { return rubric; }
        public Double getStrictness() { return strictness; }
    }
}
