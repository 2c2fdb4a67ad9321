package io.tripdata.jetty.testserver;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A canned HTTP exchange served by {@link ScriptedResourceServlet}.
 * <p>
 * HEAD and GET are scripted independently so tests can model servers that answer the two
 * methods inconsistently, for example a HEAD that fails or omits the length while GET succeeds.
 * Any method that is not scripted answers 405.
 */
public final class ScriptedResponse {

    private final Map<String, Reply> replies;

    private ScriptedResponse(Map<String, Reply> replies) {
        this.replies = Collections.unmodifiableMap(new LinkedHashMap<>(replies));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param method an HTTP method name
     * @return the scripted reply, or null if the method is not scripted
     */
    public Reply replyFor(String method) {
        return replies.get(method.toUpperCase(Locale.ROOT));
    }

    /**
     * One scripted reply.
     *
     * @param status status code
     * @param headers response headers, set verbatim
     * @param body body bytes for GET, may be null
     * @param chunked commit the headers before writing so no Content-Length is computed
     */
    public record Reply(int status, Map<String, String> headers, byte[] body, boolean chunked) {
        public Reply {
            headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        }
    }

    public static final class Builder {
        private final Map<String, Reply> replies = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder head(int status, Map<String, String> headers) {
            replies.put("HEAD", new Reply(status, headers, null, false));
            return this;
        }

        public Builder get(int status, Map<String, String> headers, byte[] body) {
            replies.put("GET", new Reply(status, headers, body, false));
            return this;
        }

        public Builder get(int status, Map<String, String> headers, String body) {
            return get(status, headers, body.getBytes(StandardCharsets.UTF_8));
        }

        /** GET reply sent with chunked transfer encoding, so the client sees no length. */
        public Builder chunkedGet(int status, Map<String, String> headers, byte[] body) {
            replies.put("GET", new Reply(status, headers, body, true));
            return this;
        }

        /** Answer both methods with a redirect to {@code location}. */
        public Builder redirect(int status, String location) {
            Map<String, String> headers = Map.of("Location", location);
            replies.put("HEAD", new Reply(status, headers, null, false));
            replies.put("GET", new Reply(status, headers, null, false));
            return this;
        }

        public ScriptedResponse build() {
            return new ScriptedResponse(replies);
        }
    }
}
