package me.golemcore.ngchat.infrastructure.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} used by the pointer fetchers. Timeouts come from
 * {@code ngchat.pointer.*}; redirects are followed.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final NgChatProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        NgChatProperties.PointerProperties pointer = properties.getPointer();

        return new OkHttpClient.Builder()
                .connectTimeout(pointer.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(pointer.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .retryOnConnectionFailure(false)
                .build();
    }
}
