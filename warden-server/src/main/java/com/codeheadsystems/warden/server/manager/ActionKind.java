package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.server.exception.ValidationException;
import java.util.Arrays;

/**
 * The closed set of actions accepted by {@link CredentialRotationManager#dispatch}.
 */
public enum ActionKind {
  LOGIN("login"),
  LOGOUT("logout"),
  CHANGE_PASSWORD("change_password");

  private final String actionName;

  ActionKind(String actionName) {
    this.actionName = actionName;
  }

  /**
   * Resolves an action by its wire name.
   *
   * @param name the action name
   * @return the action
   * @throws ValidationException if the name is missing or unknown
   */
  public static ActionKind fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("invalid_action", "Invalid action.");
    }
    String trimmed = name.strip();
    return Arrays.stream(values())
        .filter(kind -> kind.actionName.equals(trimmed))
        .findFirst()
        .orElseThrow(() -> new ValidationException("invalid_action", "Invalid action."));
  }

  public String actionName() {
    return actionName;
  }
}
