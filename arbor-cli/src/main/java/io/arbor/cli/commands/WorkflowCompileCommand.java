package io.arbor.cli.commands;

import io.arbor.core.ArborConfig;
import io.arbor.core.ArborEnvironment;
import io.arbor.core.compiler.CompilationResult;
import io.arbor.core.workflow.Workflow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// CLI command for compiling a workflow to Java source.
///
/// Writes the generated class to stdout, or to a file with `-o`. When `-o` names a
/// directory the file is placed under it following the package layout. Compiler warnings
/// go to stderr.
///
/// ### Usage
/// ```bash
/// arbor compile [--class-name <name>] [--package <pkg>] [-o <path>] [-w <dir>] <workflow.json>
/// ```
@Command(name = "compile", description = "Compile a workflow to Java source")
public class WorkflowCompileCommand extends WorkflowCommand {

    @Option(
            names = {"--class-name"},
            description = "Name of the generated class (default: CompiledWorkflows)")
    private String className;

    @Option(
            names = {"--package"},
            description = "Package of the generated class (default: none)")
    private String packageName;

    @Option(
            names = {"-o", "--output"},
            description = "Output .java file or directory (default: stdout)")
    private Path output;

    @Override
    protected ArborConfig loadConfig() throws IOException {
        ArborConfig config = super.loadConfig();
        if (className != null) {
            config.setCompiledClassName(className);
        }
        if (packageName != null) {
            config.setCompiledPackage(packageName);
        }
        return config;
    }

    @Override
    protected void execute() throws IOException {
        Workflow workflow = loadWorkflow();
        try (ArborEnvironment environment = createEnvironment(workflow)) {
            CompilationResult result = environment.compile(workflow);
            result.warnings().forEach(warning -> System.err.println(" [WARN] " + warning));

            if (!result.success()) {
                System.err.println(result.error());
                fail("Compilation failed");
                return;
            }
            if (output == null) {
                System.out.print(result.code());
                return;
            }
            Path target = resolveTarget(environment.getConfig());
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, result.code());
            System.out.println(" [OK] Wrote " + target);
        }
    }

    private Path resolveTarget(ArborConfig config) {
        if (!Files.isDirectory(output)) {
            return output;
        }
        Path dir = output;
        String pkg = config.getCompiledPackage();
        if (pkg != null && !pkg.isBlank()) {
            dir = dir.resolve(pkg.replace('.', '/'));
        }
        return dir.resolve(config.getCompiledClassName() + ".java");
    }
}
