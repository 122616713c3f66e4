package com.baton.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.ConnectException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context,
 * against a mocked API client.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final ObjectMapper objectMapper = new ObjectMapper();
    private BatonApiClient client;

    @BeforeEach
    void setUp() {
        client = mock(BatonApiClient.class);
        when(client.getBaseUrl()).thenReturn("http://localhost:8080");
    }

    private BatonApiClient.ApiResponse response(int status, String json) throws Exception {
        return new BatonApiClient.ApiResponse(status, objectMapper.readTree(json));
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == StatusCommand.class) return (K) new StatusCommand(client);
                if (cls == WavesCommand.class) return (K) new WavesCommand(client);
                if (cls == ClaimCommand.class) return (K) new ClaimCommand(client);
                if (cls == TransitionCommand.class) return (K) new TransitionCommand(client);
                if (cls == ScopeCommand.class) return (K) new ScopeCommand(client);
                if (cls == HealthCommand.class) return (K) new HealthCommand(client);
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
            int exitCode = new CommandLine(new BatonCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : new String[] {"status", "waves", "claim", "transition", "scope", "health", "serve"}) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Baton 0.1.0"));
        }

        @Test
        @DisplayName("scope --help shows the claim and exclude options")
        void scopeHelp() {
            CliResult result = execute("scope", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--claim"));
            assertTrue(result.output().contains("--exclude"));
        }

        @Test
        @DisplayName("claim without --actor is a usage error")
        void claimNeedsActor() {
            CliResult result = execute("claim", "7");
            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("--actor"));
        }
    }

    @Nested
    @DisplayName("Commands against the API")
    class ApiTests {

        @Test
        @DisplayName("status prints phase, labels and violations")
        void status() throws Exception {
            when(client.get("/api/v1/work-items/7")).thenReturn(response(200, """
                    {"id":"7","title":"Index builder","phase":"dev_open","status_label":"in-progress",
                     "open_thread":"dev","assignee":"alice","epic_id":"100","wave":"1",
                     "labels":["phase:dev","state:dev_open"],"claimed":["src/Index.java"],"excluded":[]}
                    """));
            when(client.get("/api/v1/work-items/7/violations")).thenReturn(response(200, """
                    [{"actor":"alice","kind":"INCOMPLETE_INIT","occurrences":2,"level":"WARNING"}]
                    """));
            when(client.get("/api/v1/work-items/7/checkpoint")).thenReturn(response(200, """
                    {"valid":false,"reason":"No checkpoint has been posted"}
                    """));

            CliResult result = execute("status", "#7");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WORK ITEM #7"));
            assertTrue(result.output().contains("Phase: dev_open"));
            assertTrue(result.output().contains("src/Index.java"));
            assertTrue(result.output().contains("INCOMPLETE_INIT"));
            assertTrue(result.output().contains("No checkpoint has been posted"));
        }

        @Test
        @DisplayName("claim posts the actor and confirms")
        void claim() throws Exception {
            when(client.post(eq("/api/v1/work-items/7/claim"), eq(Map.of("actor", "alice"))))
                    .thenReturn(response(200, """
                            {"work_item_id":"7","from":"ready","to":"claimed","actor":"alice","violations":[]}
                            """));

            CliResult result = execute("claim", "7", "--actor", "alice");

            assertTrue(result.output().contains("#7 claimed by alice"));
        }

        @Test
        @DisplayName("a rejected transition prints the broken rule")
        void rejectedTransition() throws Exception {
            when(client.post(eq("/api/v1/work-items/7/transitions"), eq(Map.of(
                    "from", "dev_open", "to", "test_open", "actor", "bob"))))
                    .thenReturn(response(409, """
                            {"error":"No transition from dev_open to test_open","rule":"ILLEGAL_TRANSITION"}
                            """));

            CliResult result = execute("transition", "7", "--from", "dev_open", "--to", "test_open", "--actor", "bob");

            assertTrue(result.output().contains("[ILLEGAL_TRANSITION] No transition from dev_open to test_open"));
        }

        @Test
        @DisplayName("scope splits the claim list and reports conflicts")
        void scope() throws Exception {
            when(client.post(eq("/api/v1/work-items/7/scope"), org.mockito.ArgumentMatchers.any()))
                    .thenReturn(response(201, """
                            {"work_item_id":"7","claimed":["a.java","b.java"],"excluded":[],
                             "conflicts":[{"counterpart":"8","resources":["b.java"]}]}
                            """));

            CliResult result = execute("scope", "7", "-a", "alice", "-c", "a.java,b.java");

            assertTrue(result.output().contains("Scope declared on #7"));
            assertTrue(result.output().contains("Conflicts with #8"));
        }

        @Test
        @DisplayName("health reports a degraded component")
        void health() throws Exception {
            when(client.get("/api/v1/health")).thenReturn(response(200, """
                    {"status":"UP","components":{
                      "ticket-store":{"status":"UP","detail":"Ticket store reachable"},
                      "epic-broadcast":{"status":"DEGRADED","detail":"Blocking violations are not broadcast"}}}
                    """));

            CliResult result = execute("health");

            assertTrue(result.output().contains("ticket-store: Ticket store reachable"));
            assertTrue(result.output().contains("one or more components degraded or down"));
        }

        @Test
        @DisplayName("a server that is not running gets a hint instead of a stack trace")
        void serverDown() throws Exception {
            when(client.get(anyString())).thenThrow(new ConnectException("Connection refused"));

            CliResult result = execute("waves", "100");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Cannot connect to Baton server at http://localhost:8080"));
            verify(client).get("/api/v1/epics/100/waves");
        }
    }
}
