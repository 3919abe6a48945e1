package me.golemcore.ngchat;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Chat agent for the Neuroglancer viewer.
 *
 * <p>
 * A language model drives a per-session viewer state through a bounded tool
 * loop; every state change is reported back as a shareable viewer URL.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout (ports and adapters):
 *
 * <pre>
 * Input Layer        → AgentChatController, ViewerStateController
 * Domain Layer       → ToolLoopSystem, ToolDispatcher, ViewerState, Services
 * Infrastructure     → LLM / pointer fetch / query sandbox adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code ngchat.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NgChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(NgChatApplication.class, args);
    }

}
