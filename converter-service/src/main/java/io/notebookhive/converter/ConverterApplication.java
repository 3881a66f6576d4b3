package io.notebookhive.converter;

import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@EnableRabbit
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.notebookhive.converter")
public class ConverterApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConverterApplication.class, args);
  }
}
