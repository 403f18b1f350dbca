package co.mikrodiagram.generators.mikroorm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class GeneratedSourceWriterTest {

  @TempDir
  Path tempDir;

  private final GeneratedSourceWriter writer = new GeneratedSourceWriter();

  @Test
  void shouldWriteFlatLayout() throws IOException {
    Map<String, String> code = new LinkedHashMap<>();
    code.put("User", "export class User {\n}");
    code.put("Role", "export enum Role {\n}");
    Path out = tempDir.resolve("src/entities");

    List<Path> written = writer.writeFlat(code, out);

    assertThat(written).containsExactly(out.resolve("User.ts"), out.resolve("Role.ts"));
    assertThat(Files.readString(out.resolve("User.ts"))).isEqualTo("export class User {\n}");
  }

  @Test
  void shouldOverwriteExistingFiles() throws IOException {
    Files.writeString(tempDir.resolve("User.ts"), "stale");

    writer.writeFlat(Map.of("User", "fresh"), tempDir);

    assertThat(Files.readString(tempDir.resolve("User.ts"))).isEqualTo("fresh");
  }

  @Test
  void shouldWriteCategorizedLayout() throws IOException {
    CategorizedCode code = new CategorizedCode(
        Map.of("User", "entity"),
        Map.of(),
        Map.of("Role", "enum"),
        Map.of("Auditable", "interface"));

    List<Path> written = writer.writeCategorized(code, tempDir);

    assertThat(written).hasSize(3);
    assertThat(Files.readString(tempDir.resolve("entities/User.ts"))).isEqualTo("entity");
    assertThat(Files.readString(tempDir.resolve("enums/Role.ts"))).isEqualTo("enum");
    assertThat(Files.readString(tempDir.resolve("interfaces/Auditable.ts"))).isEqualTo("interface");
    assertThat(tempDir.resolve("embeddables")).doesNotExist();
  }

  @Test
  void shouldFailWhenOutputIsAFile() throws IOException {
    Path blocker = tempDir.resolve("out");
    Files.writeString(blocker, "not a directory");

    assertThatThrownBy(() -> writer.writeFlat(Map.of("User", "x"), blocker))
        .isInstanceOf(IOException.class);
  }
}
