package com.scholary.mp3.converter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Mp3ConverterApplication {

  public static void main(String[] args) {
    SpringApplication.run(Mp3ConverterApplication.class, args);
  }
}
