package io.arbor.serialization;

import io.arbor.core.workflow.Workflow;
import io.arbor.core.workflow.WorkflowRepository;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

/// Loads workflow documents from disk into a {@link WorkflowRepository}.
///
/// Used to make sub-workflows available to the interpreter and compiler: every `*.json`
/// file directly inside a directory is parsed and saved under its workflow id.
public final class WorkflowFiles {

    private static final Logger logger = Logger.getLogger(WorkflowFiles.class.getName());

    private WorkflowFiles() {
        // Utility class - prevent instantiation
    }

    /// Loads every `*.json` document in a directory, in file-name order.
    ///
    /// @param directory directory to scan, not null
    /// @param repository target repository, not null
    /// @return the loaded workflows, never null
    /// @throws IOException if the directory or a file cannot be read
    /// @throws IllegalArgumentException if a document is malformed or has no id
    public static List<Workflow> loadDirectory(Path directory, WorkflowRepository repository)
            throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        }

        List<Workflow> loaded = new ArrayList<>();
        for (Path file : files) {
            Workflow workflow = readFile(file);
            if (workflow.getId() == null || workflow.getId().isBlank()) {
                throw new IllegalArgumentException(file.getFileName() + ": workflow has no id");
            }
            repository.save(workflow);
            loaded.add(workflow);
            logger.fine(() -> "Loaded workflow '" + workflow.getId() + "' from " + file);
        }
        logger.info("Loaded " + loaded.size() + " workflow(s) from " + directory);
        return loaded;
    }

    private static Workflow readFile(Path file) throws IOException {
        try {
            return WorkflowSerializer.read(file);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
