package com.logimetrics.coordinator.health;

import com.logimetrics.coordinator.config.HealthProperties;
import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/** Unhealthy when the data directory is missing, read-only or nearly full. */
@Component
public class FilesystemProbe implements StoreProbe {

  static final double MIN_FREE_RATIO = 0.05;

  private final Path path;

  public FilesystemProbe(HealthProperties properties) {
    this.path = Path.of(properties.filesystemPath());
  }

  @Override
  public String name() {
    return "filesystem";
  }

  @Override
  public void probe() throws IOException {
    if (!Files.isDirectory(path) || !Files.isWritable(path)) {
      throw new IOException("directory not writable: " + path.toAbsolutePath());
    }
    final FileStore store = Files.getFileStore(path);
    final long total = store.getTotalSpace();
    if (total > 0 && (double) store.getUsableSpace() / total < MIN_FREE_RATIO) {
      throw new IOException("free space below " + (int) (MIN_FREE_RATIO * 100) + "%");
    }
  }
}
