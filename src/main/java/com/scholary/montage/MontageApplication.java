package com.scholary.montage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MontageApplication {

  public static void main(String[] args) {
    SpringApplication.run(MontageApplication.class, args);
  }
}
