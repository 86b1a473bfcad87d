package org.elogsync.pipeline.resources.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.elogsync.pipeline.api.contracts.DetectorStatus;
import org.elogsync.pipeline.api.contracts.ExperimentRecord;
import org.elogsync.pipeline.api.contracts.LogbookEntry;
import org.elogsync.pipeline.api.contracts.QuestionnaireField;
import org.elogsync.pipeline.api.contracts.RecordBundle;
import org.elogsync.pipeline.api.contracts.RunRecord;
import org.elogsync.pipeline.api.contracts.WorkflowDefinition;
import org.elogsync.pipeline.api.source.AuthenticationException;
import org.elogsync.pipeline.api.source.ICredentialProvider;
import org.elogsync.pipeline.api.source.IRemoteSource;
import org.elogsync.pipeline.api.source.PermanentSourceException;
import org.elogsync.pipeline.api.source.SourceUnavailableException;
import org.elogsync.pipeline.api.source.TransientSourceException;
import org.elogsync.pipeline.resources.AbstractResource;
import org.elogsync.pipeline.resources.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Remote source backed by the SLAC elog web service.
 * <p>
 * One {@link #fetchRecord(String)} call performs every request needed for a complete bundle
 * (info, elog, runs with per-run details, files, questionnaire, workflow definitions) and fails as
 * a whole if any of them fails. Responses are classified as follows:
 * <ul>
 *   <li>timeouts, I/O errors, 5xx and 429: {@link TransientSourceException}</li>
 *   <li>401 after one credential refresh, 403, other 4xx, malformed JSON and
 *       {@code success=false} envelopes: {@link PermanentSourceException}</li>
 * </ul>
 * The experiment listing is public and retried here up to {@code list-attempts} times.
 */
public class ElogHttpSource extends AbstractResource implements IRemoteSource {

    private static final Logger log = LoggerFactory.getLogger(ElogHttpSource.class);

    static final String LIST_ENDPOINT = "/ws/lgbk/lgbk/ws/experiment_names_updated_within";
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_.-]+");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final ICredentialProvider credentials;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final RetryPolicy listRetry;

    private final AtomicLong requestCount = new AtomicLong(0);
    private final AtomicLong transientErrors = new AtomicLong(0);
    private final AtomicLong permanentErrors = new AtomicLong(0);

    /**
     * Constructs the source from its configuration block ({@code elogsync.source}).
     *
     * @param name    The resource name.
     * @param options The source options.
     */
    public ElogHttpSource(String name, Config options) {
        this(name, options, TokenCredentialProvider.fromConfig(
            options.hasPath("auth") ? options.getConfig("auth") : ConfigFactory.empty()));
    }

    ElogHttpSource(String name, Config options, ICredentialProvider credentials) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "base-url", "https://pswww.slac.stanford.edu",
            "connect-timeout", "10s",
            "request-timeout", "60s",
            "list-attempts", 3,
            "list-retry-delay", "1s"
        ));
        Config config = options.withFallback(defaults);

        String url = config.getString("base-url");
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.requestTimeout = config.getDuration("request-timeout");
        Duration listDelay = config.getDuration("list-retry-delay");
        this.listRetry = new RetryPolicy(config.getInt("list-attempts"), listDelay, listDelay.multipliedBy(8), 0.2);
        this.credentials = credentials;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.getDuration("connect-timeout"))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public void checkCredentials() throws AuthenticationException {
        credentials.authorizationHeader();
    }

    @Override
    public List<String> listChanged(Duration window) throws SourceUnavailableException, InterruptedException {
        long offsetSecs = Math.max(0, window.getSeconds());
        String endpoint = LIST_ENDPOINT + "?offset_secs=" + offsetSecs;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                JsonNode body = get(endpoint, false);
                return toIdentifiers(body);
            } catch (TransientSourceException e) {
                if (!listRetry.canRetry(attempt)) {
                    log.error("Experiment listing failed after {} attempts: {}", attempt, e.getMessage());
                    throw new SourceUnavailableException(
                        "Experiment listing failed after " + attempt + " attempts: " + e.getMessage(), e);
                }
                long delay = listRetry.delayMs(attempt - 1);
                log.debug("Experiment listing attempt {}/{} failed ({}), retrying in {} ms",
                    attempt, listRetry.getMaxAttempts(), e.getMessage(), delay);
                TimeUnit.MILLISECONDS.sleep(delay);
            } catch (PermanentSourceException e) {
                log.error("Experiment listing rejected: {}", e.getMessage());
                throw new SourceUnavailableException("Experiment listing rejected: " + e.getMessage(), e);
            }
        }
    }

    private List<String> toIdentifiers(JsonNode body) throws PermanentSourceException {
        JsonNode values;
        if (body.isObject() && body.has("value")) {
            values = body.get("value");
        } else if (body.isArray()) {
            values = body;
        } else {
            throw new PermanentSourceException("Unexpected listing response of type " + body.getNodeType());
        }
        List<String> ids = new ArrayList<>();
        for (JsonNode v : values) {
            String id = v.isTextual() ? v.asText()
                : ElogResponseMapper.text(v, v.has("name") ? "name" : "_id");
            if (id != null && !id.isBlank()) {
                ids.add(id);
            }
        }
        log.debug("Listing returned {} experiments", ids.size());
        return ids;
    }

    @Override
    public RecordBundle fetchRecord(String experimentId)
            throws TransientSourceException, PermanentSourceException, InterruptedException {
        if (experimentId == null || !VALID_ID.matcher(experimentId).matches()) {
            throw new PermanentSourceException("Invalid experiment identifier: " + experimentId);
        }
        String base = "/ws-kerb/lgbk/lgbk/" + experimentId + "/ws";

        JsonNode info = envelopeValue(get(base + "/info", true), experimentId, "info");
        ExperimentRecord experiment = ElogResponseMapper.toExperiment(experimentId, info);

        JsonNode elog = envelopeValue(get(base + "/elog", true), experimentId, "elog");
        List<LogbookEntry> logbook = ElogResponseMapper.toLogbook(experimentId, elog);

        Map<Integer, JsonNode> runDetails = fetchRunDetails(base);
        List<RunRecord> runs = ElogResponseMapper.toRuns(runDetails);
        List<DetectorStatus> detectors = ElogResponseMapper.toDetectorStatus(runDetails);

        JsonNode files = envelopeValue(get(base + "/files", true), experimentId, "files");
        runs = ElogResponseMapper.mergeFiles(runs, files);

        List<QuestionnaireField> questionnaire = fetchQuestionnaire(experimentId, experiment.urawiProposal());

        JsonNode workflows = envelopeValue(get(base + "/workflow_definitions", true), experimentId, "workflow");
        List<WorkflowDefinition> workflowDefinitions = ElogResponseMapper.toWorkflows(workflows);

        log.debug("Fetched {}: {} runs, {} logbook entries, {} questionnaire fields, {} workflows",
            experimentId, runs.size(), logbook.size(), questionnaire.size(), workflowDefinitions.size());
        return new RecordBundle(experimentId, experiment, runs, detectors, logbook, questionnaire, workflowDefinitions);
    }

    private Map<Integer, JsonNode> fetchRunDetails(String base)
            throws TransientSourceException, PermanentSourceException, InterruptedException {
        JsonNode runList = get(base + "/runs?includeParams=false", true).path("value");
        Map<Integer, JsonNode> details = new LinkedHashMap<>();
        for (JsonNode run : runList) {
            Integer num = ElogResponseMapper.integer(run.get("num"));
            if (num == null) {
                continue;
            }
            JsonNode detail = get(base + "/runs/" + num + "?includeParams=true", true).path("value");
            details.put(num, detail.isObject() ? detail : objectMapper.createObjectNode());
        }
        return details;
    }

    private List<QuestionnaireField> fetchQuestionnaire(String experimentId, String proposal)
            throws TransientSourceException, PermanentSourceException, InterruptedException {
        Optional<String> lclsRun = ElogResponseMapper.lclsRun(experimentId);
        if (proposal == null || proposal.isBlank() || lclsRun.isEmpty()) {
            log.debug("No questionnaire for {} (proposal={}, run digits present={})",
                experimentId, proposal, lclsRun.isPresent());
            return List.of();
        }
        String endpoint = "/ws-kerb/questionnaire/ws/proposal/attribute/run" + lclsRun.get() + "/" + proposal;
        try {
            return ElogResponseMapper.toQuestionnaire(proposal, get(endpoint, true));
        } catch (PermanentSourceException e) {
            if (e.getStatusCode() == 404) {
                log.debug("No questionnaire published for {} ({})", experimentId, proposal);
                return List.of();
            }
            throw e;
        }
    }

    private JsonNode envelopeValue(JsonNode body, String experimentId, String part) throws PermanentSourceException {
        if (!body.path("success").asBoolean(false)) {
            permanentErrors.incrementAndGet();
            throw new PermanentSourceException("API returned success=false for " + part + " of " + experimentId);
        }
        JsonNode value = body.get("value");
        if (value == null || value.isNull()) {
            return objectMapper.createArrayNode();
        }
        return value;
    }

    /**
     * Performs one GET request and parses the body as JSON.
     */
    JsonNode get(String endpoint, boolean authenticated)
            throws TransientSourceException, PermanentSourceException, InterruptedException {
        HttpResponse<String> response = send(endpoint, authenticated);
        if (response.statusCode() == 401 && authenticated) {
            log.debug("Got 401 for {}, refreshing credential", endpoint);
            credentials.refresh();
            response = send(endpoint, true);
            if (response.statusCode() == 401) {
                permanentErrors.incrementAndGet();
                throw new PermanentSourceException("Access denied for " + endpoint + " (401)", 401);
            }
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            transientErrors.incrementAndGet();
            throw new TransientSourceException("HTTP " + status + " for " + endpoint, status);
        }
        if (status == 403) {
            permanentErrors.incrementAndGet();
            throw new PermanentSourceException("Access denied to " + endpoint + " (403)", 403);
        }
        if (status < 200 || status >= 300) {
            permanentErrors.incrementAndGet();
            throw new PermanentSourceException("HTTP " + status + " for " + endpoint + ": " + abbreviate(response.body()), status);
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            permanentErrors.incrementAndGet();
            throw new PermanentSourceException("Malformed JSON from " + endpoint + ": " + e.getOriginalMessage(), e);
        }
    }

    private HttpResponse<String> send(String endpoint, boolean authenticated)
            throws TransientSourceException, PermanentSourceException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + endpoint))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET();
        if (authenticated) {
            try {
                credentials.authorizationHeader().ifPresent(h -> builder.header("Authorization", h));
            } catch (AuthenticationException e) {
                permanentErrors.incrementAndGet();
                throw new PermanentSourceException(e.getMessage(), e);
            }
        }

        requestCount.incrementAndGet();
        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            transientErrors.incrementAndGet();
            throw new TransientSourceException("Timeout calling " + endpoint, e);
        } catch (IOException e) {
            transientErrors.incrementAndGet();
            throw new TransientSourceException("Network error calling " + endpoint + ": " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("requests_total", requestCount.get());
        metrics.put("transient_errors", transientErrors.get());
        metrics.put("permanent_errors", permanentErrors.get());
    }
}
