package com.codeheadsystems.warden.springboot.testapp;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.warden.model.credential.ActionRequest;
import com.codeheadsystems.warden.model.credential.ActionResponse;
import com.codeheadsystems.warden.model.credential.ChangeSecretRequest;
import com.codeheadsystems.warden.model.credential.LoginRequest;
import com.codeheadsystems.warden.model.credential.PasswordLoginRequest;
import com.codeheadsystems.warden.model.credential.PrincipalResponse;
import com.codeheadsystems.warden.server.model.AuditEvent;
import com.codeheadsystems.warden.server.model.AuditEventKind;
import com.codeheadsystems.warden.server.store.AuditLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CredentialControllerIntegrationTest {

  private final HttpClient httpClient = HttpClient.newHttpClient();
  private final ObjectMapper objectMapper = new ObjectMapper();

  @LocalServerPort
  private int port;

  @Autowired
  private AuditLog auditLog;

  @Test
  void login_thenMe_returnsPrincipal() throws Exception {
    String token = login("demo", "1234");

    HttpResponse<String> me = get("/credentials/me", token);

    assertThat(me.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readValue(me.body(), PrincipalResponse.class).principalId()).isEqualTo("demo");
  }

  @Test
  void login_wrongPin_returns401() throws Exception {
    assertThat(post("/credentials/login", new LoginRequest("demo", "9999"), null).statusCode())
        .isEqualTo(401);
  }

  @Test
  void login_missingFields_returns400() throws Exception {
    assertThat(post("/credentials/login", new LoginRequest(" ", "1234"), null).statusCode())
        .isEqualTo(400);
  }

  @Test
  void me_withoutToken_returns401() throws Exception {
    assertThat(get("/credentials/me", null).statusCode()).isEqualTo(401);
  }

  @Test
  void logout_revokesToken() throws Exception {
    String token = login("demo", "1234");

    assertThat(post("/credentials/logout", null, token).statusCode()).isEqualTo(200);
    assertThat(get("/credentials/me", token).statusCode()).isEqualTo(401);
    assertThat(get("/api/whoami", token).statusCode()).isEqualTo(401);
  }

  @Test
  void changePassword_commitsAndAudits() throws Exception {
    String token = login("rotator", "4321");

    HttpResponse<String> response = post("/credentials/password",
        new ChangeSecretRequest("4321", "Str0ngPass", "Str0ngPass"), token);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(auditLog.eventsFor("rotator"))
        .extracting(AuditEvent::eventName)
        .contains(AuditEventKind.PASSWORD_CHANGED.eventName());

    HttpResponse<String> rotated = post("/credentials/login/password",
        new PasswordLoginRequest("rotator", "Str0ngPass"), null);
    assertThat(rotated.statusCode()).isEqualTo(200);
    String passwordToken = objectMapper.readValue(rotated.body(), ActionResponse.class).token();
    assertThat(get("/credentials/me", passwordToken).statusCode()).isEqualTo(200);
    assertThat(post("/credentials/login/password",
        new PasswordLoginRequest("rotator", "OldPass123"), null).statusCode()).isEqualTo(401);
  }

  @Test
  void changePassword_rejections() throws Exception {
    String token = login("demo", "1234");

    assertThat(post("/credentials/password",
        new ChangeSecretRequest("1234", "Weakpass", "Weakpass"), token).statusCode()).isEqualTo(400);
    assertThat(post("/credentials/password",
        new ChangeSecretRequest("0000", "Str0ngPass", "Str0ngPass"), token).statusCode()).isEqualTo(401);
    assertThat(post("/credentials/password",
        new ChangeSecretRequest("1234", "Str0ngPass", "Str0ngPass"), null).statusCode()).isEqualTo(401);
  }

  @Test
  void actions_dispatchesAndRejectsUnknownAction() throws Exception {
    HttpResponse<String> login = post("/credentials/actions", ActionRequest.login("demo", "1234"), null);
    HttpResponse<String> unknown = post("/credentials/actions",
        new ActionRequest("drop_tables", null, null, null, null, null), null);

    assertThat(login.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readValue(login.body(), ActionResponse.class).token()).isNotBlank();
    assertThat(unknown.statusCode()).isEqualTo(400);
  }

  @Test
  void whoami_withToken_returns200() throws Exception {
    String token = login("demo", "1234");

    HttpResponse<String> response = get("/api/whoami", token);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("demo");
  }

  @Test
  void whoami_bogusToken_returns401() throws Exception {
    assertThat(get("/api/whoami", "not-a-real-token").statusCode()).isEqualTo(401);
  }

  @Test
  void health_includesSecretHasher() throws Exception {
    HttpResponse<String> response = get("/actuator/health", null);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("secretHasher");
  }

  private String login(String identity, String pin) throws Exception {
    HttpResponse<String> response = post("/credentials/login", new LoginRequest(identity, pin), null);
    assertThat(response.statusCode()).isEqualTo(200);
    return objectMapper.readValue(response.body(), ActionResponse.class).token();
  }

  private HttpResponse<String> post(String path, Object body, String token) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(
            body == null ? "{}" : objectMapper.writeValueAsString(body)));
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> get(String path, String token) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl() + path)).GET();
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return "http://localhost:" + port;
  }
}
