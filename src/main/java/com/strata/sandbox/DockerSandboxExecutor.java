package com.strata.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * {@link SandboxExecutor} that runs each snippet in a throw-away Deno container.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>the script passed base64-encoded through an environment variable</li>
 *   <li>Deno permission flags taken from the request's {@link PermissionSet}</li>
 *   <li>a container memory limit and a matching V8 heap limit</li>
 *   <li>no network unless the permission set grants it</li>
 * </ul>
 * The script prints one {@value #RESULT_MARKER} line with a JSON envelope that carries
 * either the returned value or the thrown error.
 */
public class DockerSandboxExecutor implements SandboxExecutor {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxExecutor.class);

    static final String RESULT_MARKER = "__SANDBOX_RESULT__:";
    private static final String SCRIPT_PATH = "/tmp/main.js";

    private final DockerClient dockerClient;
    private final String image;
    private final int cpuCount;
    private final ObjectMapper objectMapper;

    public DockerSandboxExecutor(DockerClient dockerClient, String image, int cpuCount, ObjectMapper objectMapper) {
        this.dockerClient = dockerClient;
        this.image = image;
        this.cpuCount = cpuCount;
        this.objectMapper = objectMapper;
    }

    @Override
    public SandboxResult execute(SandboxRequest request) {
        long start = System.currentTimeMillis();
        String script;
        try {
            script = buildScript(request.code(), request.context());
        } catch (JsonProcessingException e) {
            return SandboxResult.failed(SandboxError.RUNTIME,
                    "Execution context is not serializable: " + e.getOriginalMessage(), 0);
        }

        String containerName = "strata-sandbox-" + UUID.randomUUID();
        String containerId = null;
        try {
            var hostConfig = HostConfig.newHostConfig()
                    .withMemory((long) request.memoryLimitMb() * 1024 * 1024)
                    .withCpuCount((long) cpuCount)
                    .withNetworkMode(allowsNetwork(request.permissionSet()) ? "bridge" : "none");

            var response = dockerClient.createContainerCmd(image)
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withEnv("STRATA_SCRIPT=" + Base64.getEncoder().encodeToString(script.getBytes(StandardCharsets.UTF_8)))
                    .withEntrypoint("sh", "-c", buildShellCommand(request))
                    .exec();
            containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.debug("Sandbox {} started (container {})", containerName, containerId);

            Integer exitCode = awaitExit(containerId, request.timeoutMs());
            long elapsed = System.currentTimeMillis() - start;
            if (exitCode == null) {
                return SandboxResult.failed(SandboxError.TIMEOUT,
                        "Execution exceeded timeout of " + request.timeoutMs() + "ms", elapsed);
            }
            if (wasOomKilled(containerId) || exitCode == 137) {
                return SandboxResult.failed(SandboxError.MEMORY,
                        "Memory limit of " + request.memoryLimitMb() + "MB exceeded", elapsed);
            }
            ContainerOutput output = captureOutput(containerId);
            return parseOutput(output.stdout(), output.stderr(), elapsed);
        } catch (DockerException | DockerClientException e) {
            log.error("Sandbox container {} failed", containerName, e);
            return SandboxResult.failed(SandboxError.RUNTIME,
                    "Sandbox container failed: " + e.getMessage(), System.currentTimeMillis() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SandboxResult.failed(SandboxError.RUNTIME,
                    "Interrupted while waiting for sandbox output", System.currentTimeMillis() - start);
        } finally {
            if (containerId != null) {
                teardown(containerId);
            }
        }
    }

    // ── Script and command ──────────────────────────────────────────────

    String buildScript(String code, Map<String, Object> context) throws JsonProcessingException {
        String contextJson = objectMapper.writeValueAsString(context == null ? Map.of() : context);
        return "const context = " + contextJson + ";\n"
                + "const deps = context.deps ?? {};\n"
                + "try {\n"
                + "  const __value = await (async () => {\n"
                + code + "\n"
                + "  })();\n"
                + "  console.log(\"" + RESULT_MARKER + "\" + JSON.stringify({ success: true, result: __value === undefined ? null : __value }));\n"
                + "} catch (e) {\n"
                + "  console.log(\"" + RESULT_MARKER + "\" + JSON.stringify({ success: false, error: { type: e?.name ?? \"Error\", message: String(e?.message ?? e) } }));\n"
                + "}\n";
    }

    String buildShellCommand(SandboxRequest request) {
        List<String> parts = new ArrayList<>();
        parts.add("deno run --quiet --no-prompt");
        parts.add("--v8-flags=--max-old-space-size=" + request.memoryLimitMb());
        parts.addAll(request.permissionSet().denoFlags());
        parts.add(SCRIPT_PATH);
        return "echo \"$STRATA_SCRIPT\" | base64 -d > " + SCRIPT_PATH + " && exec " + String.join(" ", parts);
    }

    private static boolean allowsNetwork(PermissionSet set) {
        return set.denoFlags().contains("--allow-net") || set.denoFlags().contains("--allow-all");
    }

    // ── Output parsing ──────────────────────────────────────────────────

    SandboxResult parseOutput(String stdout, String stderr, long elapsedMs) {
        String resultLine = stdout.lines()
                .filter(line -> line.startsWith(RESULT_MARKER))
                .reduce((first, second) -> second)
                .orElse(null);
        if (resultLine == null) {
            String message = stderr == null || stderr.isBlank()
                    ? "No result marker found in output"
                    : sanitize(stderr.strip());
            return SandboxResult.failed(classifyMessage(message), message, elapsedMs);
        }

        Map<String, Object> envelope;
        try {
            envelope = objectMapper.readValue(resultLine.substring(RESULT_MARKER.length()), new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            return SandboxResult.failed(SandboxError.RUNTIME,
                    "Failed to parse result JSON: " + e.getOriginalMessage(), elapsedMs);
        }
        if (Boolean.TRUE.equals(envelope.get("success"))) {
            return SandboxResult.ok(envelope.get("result"), elapsedMs);
        }
        Map<?, ?> error = envelope.get("error") instanceof Map<?, ?> map ? map : Map.of();
        String type = String.valueOf(error.get("type"));
        String message = sanitize(String.valueOf(error.get("message")));
        return SandboxResult.failed(classifyUserError(type, message), message, elapsedMs);
    }

    static String classifyUserError(String type, String message) {
        if ("SyntaxError".equals(type)) {
            return SandboxError.SYNTAX;
        }
        if ("PermissionDenied".equals(type) || "NotCapable".equals(type)) {
            return SandboxError.PERMISSION;
        }
        String classified = classifyMessage(message);
        return SandboxError.SYNTAX.equals(classified) ? SandboxError.RUNTIME : classified;
    }

    static String classifyMessage(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("out of memory") || lower.contains("heap limit")) {
            return SandboxError.MEMORY;
        }
        if (message.contains("PermissionDenied") || message.contains("NotCapable")
                || message.contains("--allow-") || lower.contains("permission")) {
            return SandboxError.PERMISSION;
        }
        if (message.contains("SyntaxError") || lower.contains("unexpected token")
                || lower.contains("could not be parsed") || lower.contains("unexpected end of input")) {
            return SandboxError.SYNTAX;
        }
        return SandboxError.RUNTIME;
    }

    private static String sanitize(String message) {
        return message.replace("file://" + SCRIPT_PATH, "<sandbox>").replace(SCRIPT_PATH, "<sandbox>");
    }

    // ── Container plumbing ──────────────────────────────────────────────

    private Integer awaitExit(String containerId, long timeoutMs) {
        try {
            var callback = dockerClient.waitContainerCmd(containerId)
                    .exec(new WaitContainerResultCallback());
            return callback.awaitStatusCode(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (DockerClientException e) {
            log.warn("Sandbox {} did not finish within {}ms: {}", containerId, timeoutMs, e.getMessage());
            return null;
        }
    }

    private boolean wasOomKilled(String containerId) {
        var state = dockerClient.inspectContainerCmd(containerId).exec().getState();
        return state != null && Boolean.TRUE.equals(state.getOOMKilled());
    }

    private ContainerOutput captureOutput(String containerId) throws InterruptedException {
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        dockerClient.logContainerCmd(containerId)
                .withStdOut(true)
                .withStdErr(true)
                .withFollowStream(false)
                .exec(new LogContainerResultCallback() {
                    @Override
                    public void onNext(Frame frame) {
                        String text = new String(frame.getPayload(), StandardCharsets.UTF_8);
                        if (frame.getStreamType() == StreamType.STDERR) {
                            stderr.append(text);
                        } else {
                            stdout.append(text);
                        }
                    }
                }).awaitCompletion(30, TimeUnit.SECONDS);
        return new ContainerOutput(stdout.toString(), stderr.toString());
    }

    private void teardown(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.debug("Sandbox container {} removed", containerId);
        } catch (DockerException e) {
            log.warn("Failed to remove sandbox container {}", containerId, e);
        }
    }

    private record ContainerOutput(String stdout, String stderr) {}
}
