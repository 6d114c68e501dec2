package io.arbor.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.workflow.InMemoryWorkflowRepository;
import io.arbor.core.workflow.Workflow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowFilesTest {

    @TempDir Path dir;

    private final InMemoryWorkflowRepository repository = new InMemoryWorkflowRepository();

    @Test
    void shouldLoadEveryJsonFileInNameOrder() throws IOException {
        // Given
        Files.writeString(dir.resolve("b.json"), "{\"id\":\"second\",\"nodes\":[]}");
        Files.writeString(dir.resolve("a.json"), "{\"id\":\"first\",\"nodes\":[]}");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        // When
        List<Workflow> loaded = WorkflowFiles.loadDirectory(dir, repository);

        // Then
        assertThat(loaded).extracting(Workflow::getId).containsExactly("first", "second");
        assertThat(repository.count()).isEqualTo(2);
        assertThat(repository.findById("second")).isPresent();
    }

    @Test
    void shouldNameFileOfMalformedDocument() throws IOException {
        // Given
        Files.writeString(dir.resolve("broken.json"), "{\"id\": ");

        // When / Then
        assertThatThrownBy(() -> WorkflowFiles.loadDirectory(dir, repository))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("broken.json: Failed to deserialize workflow:");
    }

    @Test
    void shouldRequireWorkflowId() throws IOException {
        // Given
        Files.writeString(dir.resolve("anon.json"), "{\"name\":\"Anonymous\",\"nodes\":[]}");

        // When / Then
        assertThatThrownBy(() -> WorkflowFiles.loadDirectory(dir, repository))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("anon.json: workflow has no id");
        assertThat(repository.count()).isZero();
    }

    @Test
    void shouldRejectMissingDirectory() {
        assertThatThrownBy(() -> WorkflowFiles.loadDirectory(dir.resolve("missing"), repository))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Not a directory: ");
    }
}
