package com.sentinel.analyzer.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.analyzer.model.Finding;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

@Component
public class AnomalySnapshotWriter {

  private final ObjectMapper mapper = new ObjectMapper();
  private final Path path;
  private final String callback;

  public AnomalySnapshotWriter(@Value("${sentinel.snapshot.path:webapp/static/dump/anomalies.json}") String path,
                               @Value("${sentinel.snapshot.callback:handle_data}") String callback) {
    this.path = Path.of(path).toAbsolutePath();
    this.callback = callback;
  }

  public Path path() {
    return path;
  }

  public void write(List<Finding> findings) throws IOException {
    List<List<Object>> rows = findings.stream()
        .sorted(Finding.BY_BASE_NAME)
        .map(f -> List.<Object>of(List.of(f.point().timestamp(), f.point().value()), f.baseName()))
        .toList();
    String body = callback + "(" + mapper.writeValueAsString(rows) + ")";

    Path dir = path.getParent();
    Files.createDirectories(dir);
    Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
    try {
      Files.writeString(tmp, body, StandardCharsets.UTF_8);
      try {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }
}
