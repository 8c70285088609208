package com.codeheadsystems.warden.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.server.exception.ValidationException;
import org.junit.jupiter.api.Test;

class ActionKindTest {

  @Test
  void fromName_knownActions() {
    assertThat(ActionKind.fromName("login")).isEqualTo(ActionKind.LOGIN);
    assertThat(ActionKind.fromName("logout")).isEqualTo(ActionKind.LOGOUT);
    assertThat(ActionKind.fromName(" change_password ")).isEqualTo(ActionKind.CHANGE_PASSWORD);
  }

  @Test
  void fromName_unknownOrMissing_throwsValidation() {
    assertThatThrownBy(() -> ActionKind.fromName("delete_account"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> ActionKind.fromName("LOGIN"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> ActionKind.fromName(null))
        .isInstanceOf(ValidationException.class);
  }
}
