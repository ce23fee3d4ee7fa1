package de.bsommerfeld.catalogcrawler.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.catalogcrawler.core.config.CatalogConfig;
import de.bsommerfeld.catalogcrawler.core.domain.GameRecord;
import de.bsommerfeld.catalogcrawler.core.domain.SyncResult;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the remote catalog.
 *
 * <pre>
 * GET  {api}/existing-threads?limit=N&amp;offset=M   → {"thread_ids": [...]}
 * POST {api}/create-post    GameRecord             → {"post_id": ...}
 * POST {api}/create-batch   {"posts": [...]}       → {"created": n, "skipped": m}
 * </pre>
 *
 * Every request is authenticated with the {@code X-API-Key} header.
 *
 * <h3>Batch fallback</h3>
 * A failed batch call is not fatal: each record of the batch is then sent
 * on its own, so one rejected record only loses itself. Only records the
 * catalog confirmed are added to the {@link ThreadIdCache}.
 */
@Singleton
public class CatalogClient implements ExistingThreadSource {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogClient.class);

    static final String API_KEY_HEADER = "X-API-Key";

    private final CatalogConfig config;
    private final ThreadIdCache cache;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    @Inject
    public CatalogClient(CatalogConfig config, ThreadIdCache cache, ObjectMapper mapper) {
        this(config, cache, mapper, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build());
    }

    CatalogClient(CatalogConfig config, ThreadIdCache cache, ObjectMapper mapper, HttpClient httpClient) {
        this.config = config;
        this.cache = cache;
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    // =====================================================================
    // Existing threads
    // =====================================================================

    @Override
    public List<String> fetchPage(int limit, int offset) throws CatalogException {
        String url = config.getApiUrl() + "/existing-threads?limit=" + limit + "&offset=" + offset;
        HttpRequest request = newRequest(url, config.getTimeoutSeconds()).GET().build();

        HttpResponse<String> response = execute(request);
        if (response.statusCode() != 200) {
            throw new CatalogException("Failed to fetch existing threads", response.statusCode(), response.body());
        }

        JsonNode ids = readTree(response.body()).path("thread_ids");
        List<String> result = new ArrayList<>();
        for (JsonNode id : ids) {
            if (!id.isNull()) {
                result.add(id.asText());
            }
        }
        LOG.debug("Fetched {} existing thread ids at offset {}", result.size(), offset);
        return result;
    }

    // =====================================================================
    // Single post
    // =====================================================================

    /**
     * Creates one catalog entry and records its thread as present.
     *
     * @return the post id assigned by the catalog, empty if it sent none
     * @throws CatalogException if the catalog rejected the record or could
     *                          not be reached
     */
    public String sendOne(GameRecord record) throws CatalogException {
        HttpRequest request = newRequest(config.getApiUrl() + "/create-post", config.getTimeoutSeconds())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(record)))
                .build();

        HttpResponse<String> response = execute(request);
        if (!isSuccess(response.statusCode())) {
            LOG.error("Failed to create post for '{}': HTTP {} - {}", record.title(), response.statusCode(),
                    response.body());
            throw new CatalogException("Failed to create post for '" + record.title() + "'",
                    response.statusCode(), response.body());
        }

        String postId;
        try {
            postId = readTree(response.body()).path("post_id").asText("");
        } catch (CatalogException e) {
            LOG.debug("Unreadable create-post response for '{}': {}", record.title(), e.getMessage());
            postId = "";
        }
        LOG.info("Created post {} for '{}'", postId, record.title());
        cache.insert(record.threadId());
        return postId;
    }

    // =====================================================================
    // Batch
    // =====================================================================

    /**
     * Sends a batch of records, falling back to one request per record if
     * the batch call fails.
     */
    public SyncResult sendBatch(List<GameRecord> records) {
        if (records.isEmpty()) {
            return SyncResult.empty();
        }

        try {
            return sendBatchRequest(records);
        } catch (CatalogException e) {
            LOG.warn("Batch of {} records failed ({}), sending individually", records.size(), e.getMessage());
            return sendIndividually(records);
        }
    }

    private SyncResult sendBatchRequest(List<GameRecord> records) throws CatalogException {
        ObjectNode payload = mapper.createObjectNode();
        payload.set("posts", mapper.valueToTree(records));

        HttpRequest request = newRequest(config.getApiUrl() + "/create-batch", config.getBatchTimeoutSeconds())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(payload)))
                .build();

        HttpResponse<String> response = execute(request);
        if (!isSuccess(response.statusCode())) {
            throw new CatalogException("Batch request rejected", response.statusCode(), response.body());
        }

        JsonNode body = readTree(response.body());
        int created = body.path("created").asInt(0);
        int skipped = body.path("skipped").asInt(0);

        List<String> synced = new ArrayList<>(records.size());
        for (GameRecord record : records) {
            cache.insert(record.threadId());
            synced.add(record.threadId());
        }
        LOG.info("Batch sent: {} created, {} skipped", created, skipped);
        return new SyncResult(created, skipped, synced, List.of(), false);
    }

    private SyncResult sendIndividually(List<GameRecord> records) {
        List<String> synced = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (GameRecord record : records) {
            try {
                sendOne(record);
                synced.add(record.threadId());
            } catch (CatalogException e) {
                // HTTP rejections are logged by sendOne
                if (e.getStatusCode() < 0) {
                    LOG.error("Failed to send '{}': {}", record.title(), e.getMessage(), e);
                }
                failed.add(record.title());
            }
        }
        LOG.info("Individual fallback: {} of {} records created", synced.size(), records.size());
        return new SyncResult(synced.size(), 0, synced, failed, true);
    }

    // =====================================================================
    // HTTP plumbing
    // =====================================================================

    private HttpRequest.Builder newRequest(String url, long timeoutSeconds) throws CatalogException {
        try {
            return HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header(API_KEY_HEADER, config.getApiKey());
        } catch (IllegalArgumentException e) {
            throw new CatalogException("Invalid catalog URL: " + url, e);
        }
    }

    private HttpResponse<String> execute(HttpRequest request) throws CatalogException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CatalogException("Catalog unreachable: " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogException("Catalog request interrupted", e);
        }
    }

    private String toJson(Object value) throws CatalogException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Could not serialize request body", e);
        }
    }

    private JsonNode readTree(String body) throws CatalogException {
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Malformed catalog response", e);
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
