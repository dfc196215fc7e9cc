package com.streamfirst.cidmapper.boot;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings bound from the {@code cidmapper} prefix. */
@Data
@ConfigurationProperties(prefix = "cidmapper")
public class CidMapperProperties {

  private Mapping mapping = new Mapping();
  private Ownership ownership = new Ownership();

  /** Initialize both registries at startup from the configured owner and admin. */
  private boolean autoInitialize = true;

  private Demo demo = new Demo();

  @Data
  public static class Mapping {
    /** Ledger address of the mapping registry */
    private String address = "registry-ipcm";

    /** Initial owner; required when auto-initialize is on */
    private String owner;
  }

  @Data
  public static class Ownership {
    /** Ledger address of the ownership registry */
    private String address = "registry-tokens";

    /** Admin allowed to mint; required when auto-initialize is on */
    private String admin;
  }

  @Data
  public static class Demo {
    private boolean enabled = false;
  }
}
