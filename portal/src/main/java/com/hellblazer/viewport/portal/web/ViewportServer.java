package com.hellblazer.viewport.portal.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.viewport.portal.web.dto.CameraUpdateRequest;
import com.hellblazer.viewport.portal.web.dto.CameraUpdateResponse;
import com.hellblazer.viewport.queue.DeliveredImage;
import com.hellblazer.viewport.queue.ProgressiveRenderQueue;
import com.hellblazer.viewport.queue.RenderQueueConfiguration;
import com.hellblazer.viewport.render.LadderPassRenderer;
import com.hellblazer.viewport.render.QualityLadder;
import com.hellblazer.viewport.render.SphereFieldSynthesizer;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Web server exposing one progressive render stream over REST.
 * <p>
 * Clients post camera poses and poll for images. Each poll returns the best frame rendered since the previous poll,
 * or 204 when nothing newer is available. The stream never goes back to an older pose or a lower quality for the
 * same pose.
 */
public class ViewportServer {

    private static final Logger log = LoggerFactory.getLogger(ViewportServer.class);
    private static final int DEFAULT_PORT = 10001;
    private static final String VERSION = "0.0.1-SNAPSHOT";

    public static final String GENERATION_HEADER = "X-Render-Generation";
    public static final String QUALITY_HEADER = "X-Render-Quality";
    public static final String WIDTH_HEADER = "X-Image-Width";
    public static final String HEIGHT_HEADER = "X-Image-Height";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProgressiveRenderQueue queue;
    private final QualityLadder ladder;
    private final Javalin app;
    private final int port;

    /**
     * Create a server rendering the reference scene with the default ladder.
     */
    public ViewportServer(int port) {
        this(port, QualityLadder.defaultLadder());
    }

    /**
     * Create a server rendering the reference scene with the given ladder.
     * Use port 0 for dynamic port assignment (useful for testing).
     */
    public ViewportServer(int port, QualityLadder ladder) {
        this(port, new ProgressiveRenderQueue("viewport",
                                              new LadderPassRenderer(ladder, new SphereFieldSynthesizer()),
                                              RenderQueueConfiguration.defaults()), ladder);
    }

    /**
     * Create a server around an existing queue. The server owns the queue from here on and closes it on
     * {@link #stop()}.
     *
     * @param ladder the ladder the queue's renderer walks, reported by {@code /api/info}; may be null
     */
    public ViewportServer(int port, ProgressiveRenderQueue queue, QualityLadder ladder) {
        this.port = port;
        this.queue = Objects.requireNonNull(queue, "queue");
        this.ladder = ladder;
        this.app = createApp();
    }

    private Javalin createApp() {
        var javalin = Javalin.create(config -> {
            config.http.defaultContentType = "application/json";
            config.http.maxRequestSize = 64_000L;
        });

        // Global exception handler
        javalin.exception(Exception.class, (e, ctx) -> {
            log.error("Request failed: {}", ctx.path(), e);
            ctx.status(500).json(error(e.getMessage(), e.getClass().getSimpleName()));
        });

        registerHealthEndpoints(javalin);
        registerCameraEndpoints(javalin);
        registerImageEndpoints(javalin);

        javalin.exception(IllegalArgumentException.class, (e, ctx) -> {
            ctx.status(400).json(error(e.getMessage(), "BadRequest"));
        });

        javalin.exception(IllegalStateException.class, (e, ctx) -> {
            ctx.status(409).json(error(e.getMessage(), "Conflict"));
        });

        return javalin;
    }

    private static Map<String, String> error(String message, String type) {
        return Map.of(
            "error", message == null ? "" : message,
            "type", type,
            "timestamp", Instant.now().toString()
        );
    }

    // ========== Health Endpoints ==========

    private void registerHealthEndpoints(Javalin app) {
        app.get("/api/health", this::healthCheck);
        app.get("/api/info", this::serverInfo);
        app.get("/api/stats", this::statistics);
    }

    private void healthCheck(Context ctx) {
        ctx.json(Map.of(
            "status", "ok",
            "timestamp", Instant.now().toString()
        ));
    }

    private void serverInfo(Context ctx) {
        ctx.json(Map.of(
            "name", "Progressive Viewport",
            "version", VERSION,
            "stream", queue.name(),
            "ladder", ladder == null ? List.of() : ladder.profiles(),
            "statistics", queue.statistics(),
            "timestamp", Instant.now().toString()
        ));
    }

    private void statistics(Context ctx) {
        ctx.json(queue.statistics());
    }

    // ========== Camera Endpoints ==========

    private void registerCameraEndpoints(Javalin app) {
        app.post("/api/camera", this::updateCamera);
    }

    private void updateCamera(Context ctx) {
        var request = readCameraUpdate(ctx.body());
        var generation = queue.updateCamera(request.position(), request.rotation());
        ctx.status(202).json(new CameraUpdateResponse(generation));
    }

    private CameraUpdateRequest readCameraUpdate(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Camera update requires a JSON body");
        }
        CameraUpdateRequest request;
        try {
            request = objectMapper.readValue(body, CameraUpdateRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed camera update: " + e.getOriginalMessage(), e);
        }
        if (request == null) {
            throw new IllegalArgumentException("Camera update must be a JSON object");
        }
        return request;
    }

    // ========== Image Endpoints ==========

    private void registerImageEndpoints(Javalin app) {
        app.get("/api/image", this::latestImage);
    }

    private void latestImage(Context ctx) {
        var delivered = queue.getImage();
        if (delivered.isEmpty()) {
            ctx.status(204);
            return;
        }
        writeImage(ctx, delivered.get());
    }

    private void writeImage(Context ctx, DeliveredImage delivered) {
        var image = delivered.image();
        byte[] png;
        try {
            png = PngEncoder.encode(image);
        } catch (IOException e) {
            throw new UncheckedIOException("PNG encoding failed for generation " + delivered.generation(), e);
        }
        ctx.header(GENERATION_HEADER, Long.toString(delivered.generation()));
        ctx.header(QUALITY_HEADER, Integer.toString(delivered.qualityLevel()));
        ctx.header(WIDTH_HEADER, Integer.toString(image.width()));
        ctx.header(HEIGHT_HEADER, Integer.toString(image.height()));
        ctx.contentType("image/png");
        ctx.result(png);
    }

    /**
     * Start rendering, then the server.
     */
    public void start() {
        queue.start();
        app.start(port);
        var actualPort = app.port();
        log.info("=".repeat(70));
        log.info("Progressive Viewport Server started on http://localhost:{}", actualPort);
        log.info("Endpoints:");
        log.info("  - Health:    GET  /api/health");
        log.info("  - Info:      GET  /api/info");
        log.info("  - Stats:     GET  /api/stats");
        log.info("  - Camera:    POST /api/camera");
        log.info("  - Image:     GET  /api/image");
        log.info("=".repeat(70));
    }

    /**
     * Stop the server, then the render worker.
     */
    public void stop() {
        log.info("Stopping Progressive Viewport Server...");
        app.stop();
        queue.close();
        log.info("Server stopped");
    }

    /**
     * Get the actual port the server is running on.
     * Useful when started with port 0 for dynamic assignment.
     */
    public int port() {
        return app.port();
    }

    /**
     * Get the Javalin app instance (for testing).
     */
    public Javalin app() {
        return app;
    }

    public ProgressiveRenderQueue queue() {
        return queue;
    }

    /**
     * Main entry point for standalone server.
     * <p>
     * Arguments: {@code [port] [ladder.json]}
     */
    public static void main(String[] args) throws IOException {
        var port = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_PORT;
        var ladder = QualityLadder.load(args.length > 1 ? Path.of(args[1]) : null);
        var server = new ViewportServer(port, ladder);
        server.start();

        // Add shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
    }
}
