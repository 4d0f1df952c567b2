package com.modelgate.registry;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Thin JSON client for the MLflow tracking server REST API.
 *
 * <p>Connection failures and 5xx answers surface as {@link RegistryUnavailableException}; other non-2xx answers
 * as {@link MlflowApiException}.
 */
public class MlflowRestClient {
    private static final MediaType JSON = MediaType.parse("application/json");
    static final String RESOURCE_DOES_NOT_EXIST = "RESOURCE_DOES_NOT_EXIST";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;

    public MlflowRestClient(OkHttpClient httpClient, String trackingUri) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        HttpUrl parsed = HttpUrl.parse(trackingUri);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid MLflow tracking URI: " + trackingUri);
        }
        this.baseUrl = parsed;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode get(String path, Map<String, String> query) {
        HttpUrl.Builder url = url(path);
        query.forEach(url::addQueryParameter);
        return execute(new Request.Builder().url(url.build()).get().build());
    }

    /**
     * Like {@link #get}, but maps MLflow's {@code RESOURCE_DOES_NOT_EXIST} answer to an empty result.
     */
    public Optional<JsonNode> getIfExists(String path, Map<String, String> query) {
        try {
            return Optional.of(get(path, query));
        } catch (MlflowApiException e) {
            if (e.statusCode() == 404 && RESOURCE_DOES_NOT_EXIST.equals(e.errorCode())) {
                return Optional.empty();
            }
            throw e;
        }
    }

    public JsonNode post(String path, Object body) {
        String payload;
        try {
            payload = mapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to serialize MLflow request for " + path, e);
        }
        Request request = new Request.Builder()
                .url(url(path).build())
                .post(RequestBody.create(payload, JSON))
                .build();
        return execute(request);
    }

    /**
     * Raw bytes of a non-JSON resource such as a logged artifact.
     */
    public byte[] download(String path) {
        Request request = new Request.Builder().url(url(path).build()).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw failure(response.code(), body == null ? "" : body.string());
            }
            return body == null ? new byte[0] : body.bytes();
        } catch (IOException e) {
            throw new RegistryUnavailableException("MLflow unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private JsonNode execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw failure(response.code(), text);
            }
            return text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
        } catch (IOException e) {
            throw new RegistryUnavailableException("MLflow unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private RuntimeException failure(int status, String text) {
        if (status >= 500) {
            return new RegistryUnavailableException("MLflow answered status=" + status + " body=" + text);
        }
        try {
            JsonNode error = mapper.readTree(text);
            return new MlflowApiException(status, error.path("error_code").asText(""), error.path("message").asText(text));
        } catch (IOException e) {
            return new MlflowApiException(status, "", text);
        }
    }

    private HttpUrl.Builder url(String path) {
        return baseUrl.newBuilder().addPathSegments(path);
    }
}
