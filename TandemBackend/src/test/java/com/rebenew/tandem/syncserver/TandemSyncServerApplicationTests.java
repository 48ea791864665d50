package com.rebenew.tandem.syncserver;

import com.rebenew.tandem.syncserver.core.SessionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TandemSyncServerApplicationTests {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private SessionManager sessionManager;

    @Test
    void shouldCreateSessionOverHttp() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<Map> response = restTemplate.postForEntity("/api/sessions",
                new HttpEntity<>("{\"userId\":\"host-1\"}", headers), Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        String sessionId = (String) response.getBody().get("sessionId");
        assertNotNull(sessionId);
        assertEquals("host-1", sessionManager.getSession(sessionId).getHost().userId());
    }
}
