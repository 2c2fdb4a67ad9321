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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * Serves {@link ScriptedResponse}s registered on a {@link JettyFileServerFixture}.
 * Unknown paths answer 404.
 */
public class ScriptedResourceServlet extends HttpServlet {
    private static final Logger logger = LogManager.getLogger(ScriptedResourceServlet.class);

    private final Map<String, ScriptedResponse> scripts;

    ScriptedResourceServlet(Map<String, ScriptedResponse> scripts) {
        this.scripts = scripts;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String path = req.getPathInfo() == null ? "/" : req.getPathInfo();
        ScriptedResponse script = scripts.get(path);
        if (script == null) {
            logger.debug("No script for {} {}", req.getMethod(), path);
            resp.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        ScriptedResponse.Reply reply = script.replyFor(req.getMethod());
        if (reply == null) {
            resp.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
            return;
        }

        resp.setStatus(reply.status());
        reply.headers().forEach(resp::setHeader);
        if (reply.status() >= 400 || reply.body() == null || "HEAD".equals(req.getMethod())) {
            return;
        }
        if (reply.chunked()) {
            resp.flushBuffer();
        }
        try (OutputStream out = resp.getOutputStream()) {
            out.write(reply.body());
        }
    }
}
