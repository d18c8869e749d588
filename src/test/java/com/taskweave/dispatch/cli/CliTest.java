package com.taskweave.dispatch.cli;

import com.taskweave.core.engine.JobOrchestrator;
import com.taskweave.core.llm.ExecutionCapability;
import com.taskweave.core.llm.ExecutionFailedException;
import com.taskweave.core.llm.ExecutionProperties;
import com.taskweave.core.model.JobConfig;
import com.taskweave.jobs.digest.DigestProperties;
import com.taskweave.jobs.digest.DigestService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Taskweave CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final String DIGEST_JSON =
            "{\"summary\":\"A short story about tea.\",\"keyPoints\":[\"Tea is brewed\",\"Tea is served\"]}";

    @TempDir
    Path tempDir;

    private ExecutionCapability mockCapability;
    private JobOrchestrator orchestrator;
    private DigestProperties digestProperties;

    @BeforeEach
    void setUp() {
        mockCapability = mock(ExecutionCapability.class);
        orchestrator = new JobOrchestrator(mockCapability, new JobConfig(2, 0, true, "standard"));
        digestProperties = new DigestProperties();
    }

    private ExecutionProperties executionProperties() {
        var properties = new ExecutionProperties();
        var profiles = new LinkedHashMap<String, ExecutionProperties.Profile>();
        profiles.put("fast", new ExecutionProperties.Profile("gpt-4o-mini", 0.2));
        profiles.put("standard", new ExecutionProperties.Profile("gpt-4o", null));
        properties.setProfiles(profiles);
        return properties;
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == DigestCommand.class) {
                    return (K) new DigestCommand(new DigestService(mockCapability, orchestrator, digestProperties));
                }
                if (cls == ProfilesCommand.class) {
                    return (K) new ProfilesCommand(executionProperties(), orchestrator);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TaskweaveCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path writeFile(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("digest"));
            assertTrue(result.output().contains("profiles"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Taskweave 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASKWEAVE v0.1.0"));
            assertTrue(result.output().contains("Usage:"));
        }

        @Test
        @DisplayName("digest --help lists its options")
        void digestHelp() {
            CliResult result = execute("digest", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--concurrency"));
            assertTrue(result.output().contains("--fail-fast"));
        }
    }

    // =====================================================================
    //  digest command tests
    // =====================================================================

    @Nested
    @DisplayName("digest command")
    class DigestTests {

        @Test
        @DisplayName("prints the digest of a small file")
        void digestsSmallFile() throws IOException {
            when(mockCapability.execute(anyString(), anyString(), any())).thenReturn(DIGEST_JSON);
            Path file = writeFile("tea.txt", "Water is boiled. Tea is brewed. Tea is served.");

            CliResult result = execute("digest", file.toString(), "--title", "Tea");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("A short story about tea."));
            assertTrue(result.output().contains("- Tea is served"));
            assertTrue(result.output().contains("Chunks: 1/1"));
            assertTrue(result.output().contains("Digest complete."));
        }

        @Test
        @DisplayName("chunked file shows progress and a partial result")
        void chunkedFileWithFailure() throws IOException {
            digestProperties.setChunkSize(30);
            when(mockCapability.execute(anyString(), anyString(), any())).thenAnswer(invocation -> {
                String instruction = invocation.getArgument(0);
                if (instruction.contains("second")) {
                    throw new ExecutionFailedException("model overloaded");
                }
                return DIGEST_JSON;
            });
            Path file = writeFile("story.txt",
                    "This is the first paragraph.\n\nThis is the second paragraph.\n\nThis is the third paragraph.");

            CliResult result = execute("digest", file.toString(), "-c", "3");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("decomposed into 3 sub-tasks"));
            assertTrue(result.output().contains("FAIL Chunk 2/3"));
            assertTrue(result.output().contains("model overloaded"));
            assertTrue(result.output().contains("Chunks: 2/3 (partial)"));
        }

        @Test
        @DisplayName("--fail-fast exits 1 when a chunk fails")
        void failFast() throws IOException {
            digestProperties.setChunkSize(30);
            when(mockCapability.execute(anyString(), anyString(), any()))
                    .thenThrow(new ExecutionFailedException("no capacity"));
            Path file = writeFile("story.txt",
                    "This is the first paragraph.\n\nThis is the second paragraph.");

            CliResult result = execute("digest", file.toString(), "--fail-fast", "--retries", "0");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Digest failed: no capacity"));
        }

        @Test
        @DisplayName("--profile is passed to the execution capability")
        void profileOption() throws IOException {
            when(mockCapability.execute(anyString(), eq("fast"), any())).thenReturn(DIGEST_JSON);
            Path file = writeFile("tea.txt", "Tea.");

            CliResult result = execute("digest", file.toString(), "-p", "fast");

            assertEquals(0, result.exitCode());
            verify(mockCapability).execute(anyString(), eq("fast"), any());
        }

        @Test
        @DisplayName("missing file exits 2")
        void missingFile() {
            CliResult result = execute("digest", tempDir.resolve("nope.txt").toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Cannot read"));
            verifyNoInteractions(mockCapability);
        }

        @Test
        @DisplayName("empty file exits 2")
        void emptyFile() throws IOException {
            Path file = writeFile("empty.txt", "   \n");

            CliResult result = execute("digest", file.toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("is empty"));
        }

        @Test
        @DisplayName("--concurrency 0 exits 2 without calling the model")
        void zeroConcurrency() throws IOException {
            Path file = writeFile("tea.txt", "Tea.");

            CliResult result = execute("digest", file.toString(), "--concurrency", "0");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--concurrency must be at least 1"));
            verifyNoInteractions(mockCapability);
        }

        @Test
        @DisplayName("negative --retries exits 2 without calling the model")
        void negativeRetries() throws IOException {
            Path file = writeFile("tea.txt", "Tea.");

            CliResult result = execute("digest", file.toString(), "--retries=-1");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--retries must not be negative"));
            verifyNoInteractions(mockCapability);
        }
    }

    // =====================================================================
    //  profiles command tests
    // =====================================================================

    @Nested
    @DisplayName("profiles command")
    class ProfilesTests {

        @Test
        @DisplayName("lists profiles and marks the default")
        void listsProfiles() {
            CliResult result = execute("profiles");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("fast"));
            assertTrue(result.output().contains("gpt-4o-mini"));
            assertTrue(result.output().contains("(default)"));
            assertTrue(result.output().contains("concurrency=2, retries=0, continueOnError=true"));
        }
    }
}
