package com.codeheadsystems.warden.springboot.testapp;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.warden.model.credential.LoginRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "warden.rate-limit-max-attempts=5")
class RateLimitIntegrationTest {

  private final HttpClient httpClient = HttpClient.newHttpClient();
  private final ObjectMapper objectMapper = new ObjectMapper();

  @LocalServerPort
  private int port;

  @Test
  void fiveWrongPins_thenCorrectPin_returns429() throws Exception {
    for (int i = 0; i < 5; i++) {
      assertThat(login("000" + i)).isEqualTo(401);
    }

    assertThat(login("1234")).isEqualTo(429);
  }

  private int login(String pin) throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create("http://localhost:" + port + "/credentials/login"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(
            objectMapper.writeValueAsString(new LoginRequest("demo", pin))))
        .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString()).statusCode();
  }
}
