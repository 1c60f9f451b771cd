package me.golemcore.imbot.domain.model.config;

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

import java.util.function.UnaryOperator;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AuthConfig {

    private AuthType type;
    private String token;
    private String username;
    private String password;
    private String clientId;
    private String clientSecret;
    private String serviceAccountJson;
    private String authDir;
    private String accountId;

    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("auth type is required");
        }
        type.validate(this);
    }

    AuthConfig expand(UnaryOperator<String> expander) {
        return toBuilder()
                .token(expander.apply(token))
                .username(expander.apply(username))
                .password(expander.apply(password))
                .clientId(expander.apply(clientId))
                .clientSecret(expander.apply(clientSecret))
                .serviceAccountJson(expander.apply(serviceAccountJson))
                .build();
    }
}
