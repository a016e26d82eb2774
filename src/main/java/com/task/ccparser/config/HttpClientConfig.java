package com.task.ccparser.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * HTTP client used by the remote OCR engine.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient okHttpClient(@Value("${ocr.remote.timeout:300s}") Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
    }
}
