package io.arbor.core.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;

/// Compiles generated source with the system compiler and loads the class.
final class CompiledClass {

    private final Class<?> type;

    private CompiledClass(Class<?> type) {
        this.type = type;
    }

    static CompiledClass of(CompilationResult result, String className) throws Exception {
        assertThat(result.success()).as(result.error()).isTrue();
        Path dir = Files.createTempDirectory("arbor-compiled");
        Path source = dir.resolve(className + ".java");
        Files.writeString(source, result.code());

        JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
        ByteArrayOutputStream errors = new ByteArrayOutputStream();
        int status = javac.run(null, null, errors, "-d", dir.toString(), source.toString());
        assertThat(status)
                .as("javac failed:%n%s%n%s", errors.toString(StandardCharsets.UTF_8), result.code())
                .isZero();

        URLClassLoader loader = new URLClassLoader(
                new URL[] {dir.toUri().toURL()}, CompiledClass.class.getClassLoader());
        return new CompiledClass(loader.loadClass(className));
    }

    Object invoke(String methodName, Object... args) throws Exception {
        Method method = Arrays.stream(type.getMethods())
                .filter(m -> m.getName().equals(methodName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No method " + methodName));
        return method.invoke(null, args);
    }
}
