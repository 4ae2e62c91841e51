package io.relay.core.provider;

import java.time.Duration;
import okhttp3.OkHttpClient;

public final class HttpClients {

    private HttpClients() {
    }

    public static OkHttpClient streaming(Duration connectTimeout, Duration readTimeout, Duration attemptTimeout) {
        return new OkHttpClient.Builder()
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .writeTimeout(connectTimeout)
            .callTimeout(attemptTimeout)
            .retryOnConnectionFailure(false)
            .build();
    }

    public static OkHttpClient defaults() {
        return streaming(Duration.ofSeconds(20), Duration.ofSeconds(90), Duration.ofMinutes(10));
    }
}
