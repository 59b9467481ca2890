package com.example.dutybot.provider;

import com.example.dutybot.config.ProviderConfig;
import com.example.dutybot.loop.LoopApi;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

/**
 * The fixed set of supported duty providers, keyed by their config.toml table.
 */
public enum ProviderKind {

    LOOP("loop") {
        @Override
        public ProviderClient createClient(ProviderConfig config, OkHttpClient httpClient, ObjectMapper objectMapper) {
            LoopApi api = new LoopApi(config.baseUrl(), config.token(), config.team(), config.timeout(),
                    httpClient, objectMapper);
            return new LoopProviderClient(config, api);
        }
    },

    ONCALL("oncall") {
        @Override
        public ProviderClient createClient(ProviderConfig config, OkHttpClient httpClient, ObjectMapper objectMapper) {
            return new OnCallProviderClient(config, httpClient, objectMapper);
        }
    };

    private final String tableName;

    ProviderKind(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    public abstract ProviderClient createClient(ProviderConfig config, OkHttpClient httpClient,
                                                ObjectMapper objectMapper);
}
