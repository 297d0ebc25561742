package io.intellixity.semantica.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads a {@link SemanticModel} from YAML or JSON configuration.
 * <p>
 * A directory load merges every {@code *.yml}, {@code *.yaml} and {@code *.json} file in file-name
 * order, so metrics, dimensions and joins may be split across files. Names must stay unique across
 * the merged set.
 */
public final class SemanticModelLoader {
  private static final Logger log = LoggerFactory.getLogger(SemanticModelLoader.class);
  private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

  public enum Format { YAML, JSON }

  private final ObjectMapper yaml;
  private final ObjectMapper json;

  public SemanticModelLoader() {
    this(new ObjectMapper(new YAMLFactory()), new ObjectMapper());
  }

  public SemanticModelLoader(ObjectMapper yaml, ObjectMapper json) {
    this.yaml = Objects.requireNonNull(yaml, "yaml");
    this.json = Objects.requireNonNull(json, "json");
  }

  public SemanticModel load(Path file) {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file)) {
      SemanticModel model = load(in, formatOf(file));
      log.debug("semantica.model file={} metrics={} dimensions={} joins={}",
          file, model.metrics().size(), model.dimensions().size(), model.joins().size());
      return model;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read semantic model: " + file, e);
    }
  }

  public SemanticModel load(InputStream in, Format format) {
    Objects.requireNonNull(in, "in");
    ObjectMapper mapper = (format == Format.JSON) ? json : yaml;
    Map<String, Object> root;
    try {
      root = mapper.readValue(in, MAP);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to parse semantic model (" + format + ")", e);
    }
    if (root == null) throw new IllegalArgumentException("Semantic model document is empty");
    return SemanticModel.fromMap(root);
  }

  /** Parses an in-memory document; used mostly by tests and embedded configuration. */
  public SemanticModel parse(String document, Format format) {
    Objects.requireNonNull(document, "document");
    return load(new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8)), format);
  }

  public SemanticModel loadDir(Path dir) {
    Objects.requireNonNull(dir, "dir");
    if (!Files.isDirectory(dir)) throw new IllegalArgumentException("Not a directory: " + dir);

    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files = s.filter(Files::isRegularFile)
          .filter(SemanticModelLoader::isModelFile)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list semantic model directory: " + dir, e);
    }
    if (files.isEmpty()) throw new IllegalArgumentException("No semantic model files (*.yml, *.yaml, *.json) in: " + dir);

    SemanticModel.Builder merged = SemanticModel.builder();
    for (Path f : files) merged.addAll(load(f));
    SemanticModel model = merged.build();
    log.debug("semantica.model dir={} files={} metrics={} dimensions={} joins={}",
        dir, files.size(), model.metrics().size(), model.dimensions().size(), model.joins().size());
    return model;
  }

  private static boolean isModelFile(Path p) {
    String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
    return n.endsWith(".yml") || n.endsWith(".yaml") || n.endsWith(".json");
  }

  private static Format formatOf(Path p) {
    return p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json") ? Format.JSON : Format.YAML;
  }
}
