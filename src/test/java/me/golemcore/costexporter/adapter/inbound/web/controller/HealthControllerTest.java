package me.golemcore.costexporter.adapter.inbound.web.controller;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class HealthControllerTest {

    @Test
    void shouldReportOk() {
        StepVerifier.create(new HealthController().health())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("OK", response.getBody());
                })
                .verifyComplete();
    }
}
