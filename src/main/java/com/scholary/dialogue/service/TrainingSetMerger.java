package com.scholary.dialogue.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Concatenates per-recording JSONL files into a single training file.
 *
 * <p>Records keep their input order. Blank lines are dropped; lines that are not valid JSON are
 * logged and dropped. Missing or unreadable inputs are reported and the rest are still merged.
 */
@Component
public class TrainingSetMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrainingSetMerger.class);

  private final ObjectMapper objectMapper;

  public TrainingSetMerger(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Merge the inputs into the output file.
   *
   * @throws IOException if the output file cannot be written
   */
  public MergeReport merge(List<Path> inputs, Path output) throws IOException {
    List<JsonNode> records = new ArrayList<>();
    List<String> merged = new ArrayList<>();
    List<String> missing = new ArrayList<>();
    List<String> unreadable = new ArrayList<>();
    int invalidLines = 0;

    for (Path input : inputs) {
      String fileName = input.getFileName().toString();

      if (!Files.exists(input)) {
        LOGGER.warn("File '{}' not found, skipping", input);
        missing.add(fileName);
        continue;
      }

      List<String> lines;
      try {
        lines = Files.readAllLines(input, StandardCharsets.UTF_8);
      } catch (IOException e) {
        LOGGER.error("Error reading '{}': {}", fileName, e.getMessage());
        unreadable.add(fileName);
        continue;
      }

      int count = 0;
      for (int i = 0; i < lines.size(); i++) {
        String line = lines.get(i).strip();
        if (line.isEmpty()) {
          continue;
        }
        try {
          records.add(objectMapper.readTree(line));
          count++;
        } catch (JsonProcessingException e) {
          LOGGER.warn(
              "Invalid JSON in {} at line {}: {}", fileName, i + 1, e.getOriginalMessage());
          invalidLines++;
        }
      }

      merged.add(fileName);
      LOGGER.info("Processed '{}': {} conversations", fileName, count);
    }

    if (records.isEmpty()) {
      LOGGER.warn("No data to merge from {} input files", inputs.size());
      return new MergeReport(merged, missing, unreadable, 0, invalidLines, null);
    }

    if (output.getParent() != null) {
      Files.createDirectories(output.getParent());
    }
    try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      for (JsonNode record : records) {
        writer.write(objectMapper.writeValueAsString(record));
        writer.write("\n");
      }
    }

    LOGGER.info(
        "Merged {} conversations from {} files into '{}'", records.size(), merged.size(), output);
    return new MergeReport(
        merged, missing, unreadable, records.size(), invalidLines, output.toString());
  }
}
