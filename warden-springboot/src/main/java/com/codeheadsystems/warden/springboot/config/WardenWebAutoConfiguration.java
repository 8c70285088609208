package com.codeheadsystems.warden.springboot.config;

import com.codeheadsystems.warden.springboot.controller.CredentialController;
import com.codeheadsystems.warden.springboot.security.WardenSecurityConfig;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Import;

/**
 * HTTP surface: the credential controller and the bearer token security chain. Ordered ahead of
 * Boot's security auto-configuration so its default filter chain backs off.
 */
@AutoConfiguration(after = WardenAutoConfiguration.class, beforeName = {
    "org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.security.servlet.ManagementWebSecurityAutoConfiguration"})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@Import({CredentialController.class, WardenSecurityConfig.class})
public class WardenWebAutoConfiguration {
}
