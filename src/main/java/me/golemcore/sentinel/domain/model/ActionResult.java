package me.golemcore.sentinel.domain.model;

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
 * Envelope returned by the action executor. The monitor only looks at
 * {@code success}; {@code result} and {@code error} are logged.
 */
public record ActionResult(boolean success, Object result, String error) {

    public static ActionResult success(Object result) {
        return new ActionResult(true, result, null);
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, null, error);
    }
}
