package com.codeheadsystems.warden.server.resource;

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
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing the credential workflow.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /credentials/login}    - PIN login, returns a bearer token</li>
 *   <li>{@code POST /credentials/login/password} - password login, returns a bearer token</li>
 *   <li>{@code POST /credentials/logout}   - end the current session</li>
 *   <li>{@code POST /credentials/password} - rotate the password of the session principal</li>
 *   <li>{@code GET  /credentials/me}       - the session principal</li>
 *   <li>{@code POST /credentials/actions}  - single endpoint routed on an {@code action} field</li>
 * </ul>
 * All logic lives in {@link CredentialRotationManager}; this class only builds the
 * {@link RequestContext} and maps the manager's exceptions to HTTP statuses.
 */
@Singleton
@Path("/credentials")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CredentialResource {

  private static final Logger log = LoggerFactory.getLogger(CredentialResource.class);

  private final CredentialRotationManager manager;

  @Inject
  public CredentialResource(CredentialRotationManager manager) {
    this.manager = manager;
    log.info("CredentialResource({})", manager);
  }

  @POST
  @Path("/login")
  public ActionResponse login(@Context HttpServletRequest httpRequest,
                              @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                              LoginRequest req) {
    log.debug("login()");
    LoginRequest body = req == null ? new LoginRequest(null, null) : req;
    return translate(() -> ActionResponse.loggedIn(
        manager.login(body.identity(), body.secret(), contextOf(httpRequest), token(authorization))
            .token()));
  }

  @POST
  @Path("/login/password")
  public ActionResponse passwordLogin(@Context HttpServletRequest httpRequest,
                                      @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                      PasswordLoginRequest req) {
    log.debug("passwordLogin()");
    PasswordLoginRequest body = req == null ? new PasswordLoginRequest(null, null) : req;
    return translate(() -> ActionResponse.loggedIn(
        manager.passwordLogin(body.identity(), body.secret(), contextOf(httpRequest),
            token(authorization)).token()));
  }

  @POST
  @Path("/logout")
  public ActionResponse logout(@Context HttpServletRequest httpRequest,
                               @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    log.debug("logout()");
    return translate(() -> {
      manager.logout(token(authorization), contextOf(httpRequest));
      return ActionResponse.ok("Logged out.");
    });
  }

  @POST
  @Path("/password")
  public ActionResponse changePassword(@Context HttpServletRequest httpRequest,
                                       @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                       ChangeSecretRequest req) {
    log.debug("changePassword()");
    ChangeSecretRequest body = req == null ? new ChangeSecretRequest(null, null, null) : req;
    return translate(() -> {
      manager.changeSecret(token(authorization), body.oldSecret(), body.newSecret(),
          body.confirmSecret(), contextOf(httpRequest));
      return ActionResponse.ok("Password updated successfully.");
    });
  }

  @GET
  @Path("/me")
  public PrincipalResponse me(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return manager.currentPrincipal(token(authorization))
        .map(PrincipalResponse::new)
        .orElseThrow(() -> new WebApplicationException("Not authenticated.",
            Response.Status.UNAUTHORIZED));
  }

  @POST
  @Path("/actions")
  public ActionResponse action(@Context HttpServletRequest httpRequest,
                               @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                               ActionRequest req) {
    log.debug("action({})", req);
    return translate(() -> manager.dispatch(req, contextOf(httpRequest), token(authorization)));
  }

  private static String token(String authorization) {
    return BearerTokenExtractor.extract(authorization).orElse(null);
  }

  private static RequestContext contextOf(HttpServletRequest httpRequest) {
    if (httpRequest == null) {
      return new RequestContext(null, null);
    }
    return new RequestContext(httpRequest.getRemoteAddr(), httpRequest.getHeader(HttpHeaders.USER_AGENT));
  }

  /**
   * Runs a manager call, mapping its exception contract to HTTP statuses. Subclasses are
   * checked before their bases.
   */
  private static <T> T translate(Supplier<T> call) {
    try {
      return call.get();
    } catch (RateLimitedException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.TOO_MANY_REQUESTS);
    } catch (SecurityException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.UNAUTHORIZED);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (PrincipalNotFoundException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.NOT_FOUND);
    } catch (StoreFailureException e) {
      log.error("Credential store failure: {}", e.getMessage(), e);
      throw new WebApplicationException("Service unavailable", Response.Status.SERVICE_UNAVAILABLE);
    }
  }
}
