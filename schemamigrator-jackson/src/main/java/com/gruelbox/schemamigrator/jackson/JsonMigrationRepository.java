package com.gruelbox.schemamigrator.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gruelbox.schemamigrator.MigrationRecord;
import com.gruelbox.schemamigrator.MigrationRepository;
import com.gruelbox.schemamigrator.Utils;
import com.gruelbox.schemamigrator.Validator;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores each {@link MigrationRecord} as {@code <version>_<name>.json} in a directory, so that
 * generated migrations can be reviewed and committed alongside the code which needs them.
 */
@Slf4j
public final class JsonMigrationRepository implements MigrationRepository {

  private static final String SUFFIX = ".json";

  @Getter private final Path directory;
  private final ObjectMapper mapper;

  /**
   * @param directory The directory holding the records. Created on the first save.
   * @param mapper The mapper to copy and configure. Optional.
   */
  @Builder
  private JsonMigrationRepository(Path directory, ObjectMapper mapper) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.mapper = mapper == null ? new ObjectMapper() : mapper.copy();
    this.mapper.registerModule(new SchemaMigratorJacksonModule());
    this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
  }

  @Override
  public List<MigrationRecord> loadAll() {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    List<MigrationRecord> result = new ArrayList<>();
    Set<String> versions = new HashSet<>();
    for (Path file : files()) {
      MigrationRecord record = read(file);
      String expected = fileName(record);
      if (!expected.equals(file.getFileName().toString())) {
        log.warn("{} contains migration {}; expected file name {}", file, record, expected);
      }
      if (!versions.add(record.getVersion())) {
        throw new IllegalStateException(
            "More than one file in " + directory + " holds version " + record.getVersion());
      }
      result.add(record);
    }
    result.sort(Comparator.comparing(MigrationRecord::getVersion));
    log.debug("Loaded {} migrations from {}", result.size(), directory);
    return result;
  }

  @Override
  public void save(MigrationRecord record) {
    new Validator().validate(record);
    Path target = directory.resolve(fileName(record));
    Utils.uncheck(
        () -> {
          Files.createDirectories(directory);
          deleteFiles(record.getVersion(), target);
          try (Writer writer = Files.newBufferedWriter(target)) {
            mapper.writeValue(writer, record);
          }
        });
    log.info("Saved migration {} to {}", record, target);
  }

  @Override
  public void delete(String version) {
    if (Files.isDirectory(directory)) {
      Utils.uncheck(() -> deleteFiles(version, null));
    }
  }

  /**
   * @param record The record.
   * @return The name of the file the record is stored in.
   */
  public static String fileName(MigrationRecord record) {
    return record.getVersion() + "_" + record.getName() + SUFFIX;
  }

  private MigrationRecord read(Path file) {
    return Utils.uncheckedly(
        () -> {
          try (Reader reader = Files.newBufferedReader(file)) {
            return mapper.readValue(reader, MigrationRecord.class);
          } catch (IOException e) {
            throw new IOException("Failed to read migration from " + file, e);
          }
        });
  }

  private List<Path> files() {
    return Utils.uncheckedly(
        () -> {
          try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(f -> f.getFileName().toString().endsWith(SUFFIX))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
          }
        });
  }

  private void deleteFiles(String version, Path keep) throws IOException {
    String prefix = version + "_";
    for (Path file : files()) {
      if (file.getFileName().toString().startsWith(prefix) && !file.equals(keep)) {
        Files.delete(file);
        log.info("Deleted migration file {}", file);
      }
    }
  }
}
