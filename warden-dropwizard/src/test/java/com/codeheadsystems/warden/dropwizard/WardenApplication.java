package com.codeheadsystems.warden.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 */
public class WardenApplication extends Application<WardenConfiguration> {

  private final WardenBundle<WardenConfiguration> bundle = new WardenBundle<>();

  public static void main(String[] args) throws Exception {
    new WardenApplication().run(args);
  }

  @Override
  public String getName() {
    return "warden-test";
  }

  @Override
  public void initialize(Bootstrap<WardenConfiguration> bootstrap) {
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(WardenConfiguration configuration, Environment environment) {
    // Test-only protected endpoint exercising bearer auth
    environment.jersey().register(new WhoAmIResource());
  }

  public WardenBundle<WardenConfiguration> getBundle() {
    return bundle;
  }
}
