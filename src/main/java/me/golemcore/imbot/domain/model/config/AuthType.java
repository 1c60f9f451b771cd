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

/**
 * Authentication method of a bot. Each kind checks its own required fields.
 */
public enum AuthType {

    TOKEN {
        @Override
        void validate(AuthConfig auth) {
            require(auth.getToken(), "token is required for token auth");
        }
    },
    BASIC {
        @Override
        void validate(AuthConfig auth) {
            require(auth.getUsername(), "username is required for basic auth");
        }
    },
    OAUTH {
        @Override
        void validate(AuthConfig auth) {
            if (isBlank(auth.getClientId()) || isBlank(auth.getClientSecret())) {
                throw new IllegalArgumentException("clientId and clientSecret are required for oauth");
            }
        }
    },
    SERVICE_ACCOUNT {
        @Override
        void validate(AuthConfig auth) {
            require(auth.getServiceAccountJson(), "serviceAccountJson is required for service account auth");
        }
    },
    QR {
        @Override
        void validate(AuthConfig auth) {
            // session state lives in authDir and is created on first login
        }
    },
    NONE {
        @Override
        void validate(AuthConfig auth) {
            // nothing to check
        }
    };

    abstract void validate(AuthConfig auth);

    private static void require(String value, String message) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(message);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
