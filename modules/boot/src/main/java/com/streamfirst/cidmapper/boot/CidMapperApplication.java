package com.streamfirst.cidmapper.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CidMapperProperties.class)
public class CidMapperApplication {

  public static void main(String[] args) {
    SpringApplication.run(CidMapperApplication.class, args);
  }
}
