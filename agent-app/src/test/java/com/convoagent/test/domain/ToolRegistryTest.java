package com.convoagent.test.domain;

import com.convoagent.domain.conversation.model.valobj.ToolCallRequest;
import com.convoagent.domain.tool.model.valobj.ToolInvocationResult;
import com.convoagent.domain.tool.model.valobj.ToolResult;
import com.convoagent.domain.tool.model.valobj.ToolSessionContext;
import com.convoagent.domain.tool.service.ToolRegistry;
import com.convoagent.domain.tool.service.ToolRegistryFactory;
import com.convoagent.test.support.StubTool;
import com.convoagent.test.support.StubToolProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    public void setUp() {
        ToolRegistryFactory factory = new ToolRegistryFactory(List.of(new StubToolProvider(false,
                StubTool.echo("echo"),
                new StubTool("unavailable", input -> ToolResult.failure("service unavailable", 503)),
                new StubTool("silent", input -> null),
                new StubTool("exploding", input -> {
                    throw new IllegalArgumentException("bad state");
                }))), new ObjectMapper());
        registry = factory.compose(new ToolSessionContext("u-1", "t-1"));
    }

    @Test
    public void shouldRenderStringPayloadAsIs() {
        ToolInvocationResult result = registry.invoke(new ToolCallRequest("c1", "echo", "{\"value\":\"hi\"}"));

        Assertions.assertFalse(result.failed());
        Assertions.assertEquals("c1", result.callId());
        Assertions.assertEquals("echo:hi", result.content());
    }

    @Test
    public void shouldTreatMissingArgumentsAsEmptyObject() {
        ToolInvocationResult result = registry.invoke(new ToolCallRequest("c1", "echo", null));

        Assertions.assertEquals("echo:null", result.content());
    }

    @Test
    public void shouldMapUnknownToolToError() {
        ToolInvocationResult result = registry.invoke(new ToolCallRequest("c1", "nope", "{}"));

        Assertions.assertTrue(result.failed());
        Assertions.assertEquals("{\"error\":\"Unknown tool: nope\"}", result.content());
    }

    @Test
    public void shouldMapMalformedArgumentsToError() {
        ToolInvocationResult result = registry.invoke(new ToolCallRequest("c1", "echo", "{not json"));

        Assertions.assertTrue(result.failed());
        Assertions.assertTrue(result.result().getError().startsWith("Invalid arguments for tool echo: "));
    }

    @Test
    public void shouldKeepStatusCodeOfFailedResult() {
        ToolInvocationResult result = registry.invoke(new ToolCallRequest("c1", "unavailable", "{}"));

        Assertions.assertEquals("{\"error\":\"service unavailable\",\"status_code\":503}", result.content());
    }

    @Test
    public void shouldMapExceptionsAndMissingResultsToErrors() {
        Assertions.assertEquals("Tool exploding failed: bad state",
                registry.invoke(new ToolCallRequest("c1", "exploding", "{}")).result().getError());
        Assertions.assertEquals("Tool silent returned no result",
                registry.invoke(new ToolCallRequest("c2", "silent", "{}")).result().getError());
    }

    @Test
    public void shouldComposeSessionToolsOnlyForIdentifiedCaller() {
        ToolRegistryFactory factory = new ToolRegistryFactory(List.of(
                new StubToolProvider(false, StubTool.echo("http_get")),
                new StubToolProvider(true, StubTool.echo("lookup_user_by_email"))), new ObjectMapper());

        Assertions.assertEquals(List.of("http_get"), factory.statelessToolNames());
        Assertions.assertEquals(List.of("lookup_user_by_email", "http_get"),
                factory.compose(new ToolSessionContext("u-1", "t-1")).names());
        Assertions.assertEquals(List.of("http_get"), factory.compose(new ToolSessionContext(" ", "t-1")).names());
    }

    @Test
    public void shouldRejectDuplicateToolNames() {
        ToolRegistryFactory factory = new ToolRegistryFactory(List.of(
                new StubToolProvider(false, StubTool.echo("echo")),
                new StubToolProvider(false, StubTool.echo("echo"))), new ObjectMapper());

        Assertions.assertThrows(IllegalStateException.class, () -> factory.compose(new ToolSessionContext("u-1", "t-1")));
    }
}
