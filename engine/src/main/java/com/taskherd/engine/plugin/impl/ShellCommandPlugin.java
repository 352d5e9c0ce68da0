package com.taskherd.engine.plugin.impl;

import com.taskherd.engine.plugin.PluginContext;
import com.taskherd.engine.plugin.PluginException;
import com.taskherd.engine.plugin.PluginManifest;
import com.taskherd.engine.plugin.TaskPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs an external command (test suite, linter, arbitrary script).
 *
 * Command arguments may reference job parameters as {@code {name}}; every
 * parameter is also exported as {@code TASKHERD_PARAM_<NAME>}. Combined
 * stdout/stderr goes to a temp file so the wait stays interruptible; a
 * non-zero exit code fails the attempt with the output tail as diagnostic.
 */
public class ShellCommandPlugin implements TaskPlugin {

    private static final Logger log = LoggerFactory.getLogger(ShellCommandPlugin.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    // Keep stored diagnostics bounded; reports truncate further.
    static final int MAX_OUTPUT_CHARS = 64_000;

    private final PluginManifest manifest;
    private final List<String>   command;
    private final File           workingDirectory;

    public ShellCommandPlugin(PluginManifest manifest, List<String> command, File workingDirectory) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("shell plugin '" + manifest.name() + "' has no command");
        }
        this.manifest         = manifest;
        this.command          = List.copyOf(command);
        this.workingDirectory = workingDirectory;
    }

    @Override
    public PluginManifest manifest() {
        return manifest;
    }

    @Override
    public Map<String, Object> execute(PluginContext ctx) {
        List<String> argv = expand(command, ctx.params());
        Path output = null;
        Process process = null;
        try {
            output = Files.createTempFile("taskherd-" + manifest.name() + "-", ".log");
            ProcessBuilder pb = new ProcessBuilder(argv)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile());
            if (workingDirectory != null) {
                pb.directory(workingDirectory);
            }
            ctx.params().forEach((k, v) -> pb.environment().put(
                    "TASKHERD_PARAM_" + k.toUpperCase(Locale.ROOT), v == null ? "" : v.toString()));
            pb.environment().put("TASKHERD_JOB_ID", ctx.jobId().toString());

            log.info("Running {}: {}", manifest.name(), argv);
            long start = System.nanoTime();
            process = pb.start();
            int exit = process.waitFor();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            String out = tail(Files.readString(output, StandardCharsets.UTF_8));
            if (exit != 0) {
                throw new PluginException(PluginException.Kind.NON_ZERO_EXIT,
                        "command exited with code " + exit, out);
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("return_value", "exit_code=0");
            result.put("exit_code",    exit);
            result.put("elapsed_ms",   elapsedMs);
            result.put("output",       out);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginException(PluginException.Kind.CANCELLED,
                    "interrupted while waiting for command", readQuietly(output));
        } catch (IOException e) {
            throw new PluginException(PluginException.Kind.EXECUTION_ERROR,
                    "could not run " + argv + ": " + e.getMessage(), null, e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(output);
        }
    }

    static List<String> expand(List<String> template, Map<String, Object> params) {
        List<String> argv = new ArrayList<>(template.size());
        for (String arg : template) {
            Matcher m = PLACEHOLDER.matcher(arg);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                Object v = params.get(m.group(1));
                if (v == null) {
                    throw new PluginException(PluginException.Kind.INVALID_PARAMS,
                            "command references missing parameter '" + m.group(1) + "'");
                }
                m.appendReplacement(sb, Matcher.quoteReplacement(v.toString()));
            }
            m.appendTail(sb);
            argv.add(sb.toString());
        }
        return argv;
    }

    private static String tail(String s) {
        return s.length() <= MAX_OUTPUT_CHARS ? s : s.substring(s.length() - MAX_OUTPUT_CHARS);
    }

    private static String readQuietly(Path p) {
        if (p == null) return null;
        try {
            return tail(Files.readString(p, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return null;
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", p, e.getMessage());
        }
    }
}
