package com.flamingo.ai.recall;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the conversation recall backend. */
@SpringBootApplication
public class RecallApplication {

  public static void main(String[] args) throws IOException {
    // SQLite creates the database file but not its directory
    Files.createDirectories(Path.of("data"));
    SpringApplication.run(RecallApplication.class, args);
  }
}
