package me.golemcore.imbot.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Mutable status record owned by a bot. Callers always receive a copy via
 * {@link #copy()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BotStatus {

    private boolean connected;
    private boolean authenticated;
    private boolean ready;
    private Instant lastActivity;
    private String error;
    private ConnectionDetails connectionDetails;

    public boolean isHealthy() {
        return connected && authenticated && ready && (error == null || error.isEmpty());
    }

    public BotStatus copy() {
        return toBuilder()
                .connectionDetails(connectionDetails != null ? connectionDetails.toBuilder().build() : null)
                .build();
    }
}
