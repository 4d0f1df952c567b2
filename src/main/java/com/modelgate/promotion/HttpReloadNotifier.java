package com.modelgate.promotion;

import java.io.IOException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.registry.ModelVersion;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * POSTs to the serving layer's reload endpoint. The answer is logged, not interpreted.
 */
public class HttpReloadNotifier implements ReloadNotifier {
    private static final Logger log = LoggerFactory.getLogger(HttpReloadNotifier.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final String url;
    private final String token;

    public HttpReloadNotifier(OkHttpClient httpClient, String url, String token, Duration timeout) {
        this.httpClient = httpClient.newBuilder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
        this.url = url;
        this.token = token;
    }

    @Override
    public boolean isEnabled() {
        return url != null && !url.isBlank();
    }

    @Override
    public int notifyReload(ModelVersion promoted) throws IOException {
        Request.Builder requestBuilder = new Request.Builder()
                .url(url)
                .post(RequestBody.create("{}", JSON));
        if (token != null && !token.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + token);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            log.info("reload.requested url={} model={} version={} status={}",
                    url, promoted.name(), promoted.version(), response.code());
            return response.code();
        }
    }
}
