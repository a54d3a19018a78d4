package com.scholary.djset;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Service that downloads DJ sets and splits them into tagged tracks. */
@SpringBootApplication
public class DjSetSplitterApplication {

  public static void main(String[] args) {
    SpringApplication.run(DjSetSplitterApplication.class, args);
  }
}
