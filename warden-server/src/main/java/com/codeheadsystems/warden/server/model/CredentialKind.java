package com.codeheadsystems.warden.server.model;

import java.util.Arrays;

/**
 * The two independently hashed secrets a principal owns.
 */
public enum CredentialKind {

  /**
   * Short secret used to log in.
   */
  PIN("pin"),

  /**
   * Longer secret replaced by the rotation workflow.
   */
  PASSWORD("password");

  private final String columnValue;

  CredentialKind(String columnValue) {
    this.columnValue = columnValue;
  }

  /**
   * Resolves a kind from its persisted form.
   *
   * @param value the persisted value
   * @return the kind
   * @throws IllegalArgumentException if the value names no kind
   */
  public static CredentialKind fromColumnValue(String value) {
    return Arrays.stream(values())
        .filter(kind -> kind.columnValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown credential kind: " + value));
  }

  /**
   * Value used when this kind is persisted.
   *
   * @return the column value
   */
  public String columnValue() {
    return columnValue;
  }
}
