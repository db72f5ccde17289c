package me.golemcore.costexporter.infrastructure.http;

import me.golemcore.costexporter.infrastructure.config.AutoConfiguration;
import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeignClientFactoryTest {

    interface EchoApi {
        @RequestLine("GET /echo/{id}")
        Map<String, Object> echo(@Param("id") String id);
    }

    private MockWebServer server;
    private ExporterProperties properties;
    private FeignClientFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new ExporterProperties();
        properties.getHttp().setReadTimeout(500);
        properties.getHttp().setCallTimeout(2000);
        factory = new FeignClientFactory(new OkHttpConfig(properties).okHttpClient(),
                AutoConfiguration.objectMapper(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldDecodeJsonWithSharedMapper() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{\"id\":\"42\"}"));

        EchoApi api = factory.create(EchoApi.class, baseUrl());

        assertEquals("42", api.echo("42").get("id"));
    }

    @Test
    void shouldNotRetryFailedRequest() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        server.enqueue(new MockResponse().setBody("{}"));

        EchoApi api = factory.create(EchoApi.class, baseUrl());

        assertThrows(RetryableException.class, () -> api.echo("1"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void shouldApplyConfiguredTimeoutsToOkHttp() {
        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(500, client.readTimeoutMillis());
        assertEquals(2000, client.callTimeoutMillis());
        assertFalse(client.retryOnConnectionFailure());
    }

    private String baseUrl() {
        String url = server.url("/").toString();
        return url.substring(0, url.length() - 1);
    }
}
