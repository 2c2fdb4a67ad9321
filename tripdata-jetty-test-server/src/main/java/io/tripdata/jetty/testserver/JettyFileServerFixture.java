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

import jakarta.servlet.DispatcherType;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A test fixture that starts a Jetty web server hosting trip files and listing pages.
 * <p>
 * Files under the resources root are served by Jetty's {@link DefaultServlet} with byte range
 * and ETag support; their Last-Modified header follows the file's modification time. Paths
 * under {@code /scripted/} answer with canned {@link ScriptedResponse}s instead, which is how
 * tests model servers with inconsistent HEAD/GET behaviour. Every request is recorded.
 * <p>
 * Example usage:
 * ```java
 * try (JettyFileServerFixture server = new JettyFileServerFixture(dir)) {
 *     server.start();
 *     String url = server.url("yellow_tripdata_2023-01.parquet");
 * }
 * ```
 */
public class JettyFileServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JettyFileServerFixture.class);

    /** Context path prefix of scripted resources */
    public static final String SCRIPTED_PREFIX = "/scripted";

    private Server server;
    private int port;
    private final Path resourcesRoot;
    private final Map<String, ScriptedResponse> scripts = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    /**
     * Creates a new JettyFileServerFixture with the specified resources directory.
     *
     * @param resourcesRoot The root directory containing the files to serve
     */
    public JettyFileServerFixture(Path resourcesRoot) {
        logger.debug("resourcesRoot: {}", resourcesRoot);
        if (!Files.isDirectory(resourcesRoot)) {
            throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
        }
        this.resourcesRoot = resourcesRoot;
    }

    /**
     * Starts the web server on a random available port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        this.port = findAvailablePort();

        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(resourcesRoot.toAbsolutePath().toString());
        server.setHandler(context);

        context.addFilter(new FilterHolder(new RecordingFilter()), "/*", EnumSet.of(DispatcherType.REQUEST));
        context.addServlet(new ServletHolder("scripted", new ScriptedResourceServlet(scripts)), SCRIPTED_PREFIX + "/*");

        ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
        defaultServlet.setInitParameter("dirAllowed", "false");
        defaultServlet.setInitParameter("welcomeServlets", "false");
        defaultServlet.setInitParameter("redirectWelcome", "false");
        defaultServlet.setInitParameter("precompressed", "false");
        defaultServlet.setInitParameter("acceptRanges", "true");
        defaultServlet.setInitParameter("etags", "true");
        defaultServlet.setInitParameter("useFileMappedBuffer", "false");
        context.addServlet(defaultServlet, "/");

        try {
            server.start();
            logger.info("Jetty test web server started on port {} serving files from {}", port, resourcesRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * Gets the base URL of the server, with a trailing slash.
     *
     * @return The base URL of the server
     */
    public String getBaseUrl() {
        return "http://127.0.0.1:" + port + "/";
    }

    /**
     * @param relativePath a path relative to the resources root, without a leading slash
     * @return the absolute URL of the path
     */
    public String url(String relativePath) {
        return getBaseUrl() + relativePath;
    }

    /**
     * Registers a scripted response.
     *
     * @param name path below {@code /scripted/}, without a leading slash
     * @param response the canned response
     * @return the absolute URL of the scripted resource
     */
    public String script(String name, ScriptedResponse response) {
        scripts.put("/" + name, response);
        return url(SCRIPTED_PREFIX.substring(1) + "/" + name);
    }

    /**
     * @return requests seen so far, in arrival order
     */
    public List<RecordedRequest> getRequests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    /**
     * @param path the request path, starting with a slash
     * @return methods of the requests seen for the path, in arrival order
     */
    public List<String> methodsFor(String path) {
        List<String> methods = new ArrayList<>();
        for (RecordedRequest request : requests) {
            if (request.path().equals(path)) {
                methods.add(request.method());
            }
        }
        return methods;
    }

    /** Forgets recorded requests and scripts. */
    public void reset() {
        requests.clear();
        scripts.clear();
    }

    public Path getRootDirectory() {
        return resourcesRoot;
    }

    /**
     * Stops the server and releases resources.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty test web server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
        }
    }

    private int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to find available port", e);
        }
    }

    private final class RecordingFilter implements Filter {
        @Override
        public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
            HttpServletRequest http = (HttpServletRequest) request;
            Map<String, String> headers = new LinkedHashMap<>();
            for (String name : Collections.list(http.getHeaderNames())) {
                headers.put(name.toLowerCase(Locale.ROOT), http.getHeader(name));
            }
            requests.add(new RecordedRequest(http.getMethod(), http.getRequestURI(), headers));
            chain.doFilter(request, response);
        }
    }
}
