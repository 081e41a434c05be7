package com.flamingo.ai.epubcfi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** EPUB CFI service. */
@SpringBootApplication
public class EpubCfiApplication {

  public static void main(String[] args) {
    SpringApplication.run(EpubCfiApplication.class, args);
  }
}
