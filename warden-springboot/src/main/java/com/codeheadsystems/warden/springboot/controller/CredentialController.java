package com.codeheadsystems.warden.springboot.controller;

import com.codeheadsystems.warden.model.credential.ActionRequest;
import com.codeheadsystems.warden.model.credential.ActionResponse;
import com.codeheadsystems.warden.model.credential.ChangeSecretRequest;
import com.codeheadsystems.warden.model.credential.LoginRequest;
import com.codeheadsystems.warden.model.credential.PasswordLoginRequest;
import com.codeheadsystems.warden.model.credential.PrincipalResponse;
import com.codeheadsystems.warden.server.auth.BearerTokenExtractor;
import com.codeheadsystems.warden.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.warden.server.exception.RateLimitedException;
import com.codeheadsystems.warden.server.exception.StoreFailureException;
import com.codeheadsystems.warden.server.manager.CredentialRotationManager;
import com.codeheadsystems.warden.server.model.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Spring MVC counterpart of the JAX-RS credential resource. Same paths, same status mapping.
 */
@RestController
@RequestMapping("/credentials")
public class CredentialController {

  private static final Logger log = LoggerFactory.getLogger(CredentialController.class);

  private final CredentialRotationManager manager;

  public CredentialController(CredentialRotationManager manager) {
    this.manager = manager;
  }

  @PostMapping("/login")
  public ActionResponse login(HttpServletRequest httpRequest,
                              @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                              @RequestBody(required = false) LoginRequest req) {
    log.debug("login()");
    LoginRequest body = req == null ? new LoginRequest(null, null) : req;
    return translate(() -> ActionResponse.loggedIn(
        manager.login(body.identity(), body.secret(), contextOf(httpRequest), token(authorization))
            .token()));
  }

  @PostMapping("/login/password")
  public ActionResponse passwordLogin(HttpServletRequest httpRequest,
                                      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @RequestBody(required = false) PasswordLoginRequest req) {
    log.debug("passwordLogin()");
    PasswordLoginRequest body = req == null ? new PasswordLoginRequest(null, null) : req;
    return translate(() -> ActionResponse.loggedIn(
        manager.passwordLogin(body.identity(), body.secret(), contextOf(httpRequest),
            token(authorization)).token()));
  }

  @PostMapping("/logout")
  public ActionResponse logout(HttpServletRequest httpRequest,
                               @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    log.debug("logout()");
    return translate(() -> {
      manager.logout(token(authorization), contextOf(httpRequest));
      return ActionResponse.ok("Logged out.");
    });
  }

  @PostMapping("/password")
  public ActionResponse changePassword(HttpServletRequest httpRequest,
                                       @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                       @RequestBody(required = false) ChangeSecretRequest req) {
    log.debug("changePassword()");
    ChangeSecretRequest body = req == null ? new ChangeSecretRequest(null, null, null) : req;
    return translate(() -> {
      manager.changeSecret(token(authorization), body.oldSecret(), body.newSecret(),
          body.confirmSecret(), contextOf(httpRequest));
      return ActionResponse.ok("Password updated successfully.");
    });
  }

  @GetMapping("/me")
  public PrincipalResponse me(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return manager.currentPrincipal(token(authorization))
        .map(PrincipalResponse::new)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Not authenticated."));
  }

  @PostMapping("/actions")
  public ActionResponse action(HttpServletRequest httpRequest,
                               @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                               @RequestBody(required = false) ActionRequest req) {
    log.debug("action({})", req);
    return translate(() -> manager.dispatch(req, contextOf(httpRequest), token(authorization)));
  }

  private static String token(String authorization) {
    return BearerTokenExtractor.extract(authorization).orElse(null);
  }

  private static RequestContext contextOf(HttpServletRequest httpRequest) {
    return new RequestContext(httpRequest.getRemoteAddr(), httpRequest.getHeader(HttpHeaders.USER_AGENT));
  }

  private static <T> T translate(Supplier<T> call) {
    try {
      return call.get();
    } catch (RateLimitedException e) {
      throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
    } catch (SecurityException e) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, e.getMessage());
    } catch (IllegalArgumentException e) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
    } catch (PrincipalNotFoundException e) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
    } catch (StoreFailureException e) {
      log.error("Credential store failure: {}", e.getMessage(), e);
      throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Service unavailable");
    }
  }
}
