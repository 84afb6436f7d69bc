package com.scholary.djset;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DjSetSplitterApplication {

  public static void main(String[] args) {
    SpringApplication.run(DjSetSplitterApplication.class, args);
  }
}
