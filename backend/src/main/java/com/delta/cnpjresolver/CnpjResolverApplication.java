package com.delta.cnpjresolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CnpjResolverApplication {

  public static void main(String[] args) {
    // Basic auth for CONNECT tunnels is disabled by the JDK unless cleared before the first HttpClient exists.
    if (System.getProperty("jdk.http.auth.tunneling.disabledSchemes") == null) {
      System.setProperty("jdk.http.auth.tunneling.disabledSchemes", "");
    }
    SpringApplication.run(CnpjResolverApplication.class, args);
  }
}
