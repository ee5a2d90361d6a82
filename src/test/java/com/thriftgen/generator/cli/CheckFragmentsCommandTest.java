package com.thriftgen.generator.cli;

import com.thriftgen.generator.codegen.GeneratorConfig;
import com.thriftgen.generator.codegen.ScalaGenerator;
import com.thriftgen.generator.template.ClasspathFragmentLoader;
import com.thriftgen.generator.template.FragmentRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the check-fragments command.
 */
class CheckFragmentsCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testBundledFragmentsPass() {
        assertThat(execute()).isZero();
    }

    @Test
    void testDirectoryCopyOfBundledFragmentsPasses() throws IOException {
        Path dir = copyBundledFragments();

        assertThat(execute("--template-dir", tempDir.toString(), "--prefix", "/scalagen/")).isZero();
        assertThat(dir.resolve("struct.ftl")).exists();
    }

    @Test
    void testSyntaxErrorFails() throws IOException {
        Path dir = copyBundledFragments();
        Files.writeString(dir.resolve("struct.ftl"), "case class ${name}(\n<#list fields as field>\n");

        assertThat(execute("-d", tempDir.toString())).isEqualTo(1);
    }

    @Test
    void testExtraFragmentsInDirectoryAreChecked() throws IOException {
        Path dir = copyBundledFragments();
        Files.writeString(dir.resolve("extra.ftl"), "</#list>");

        assertThat(execute("-d", tempDir.toString())).isEqualTo(1);
    }

    @Test
    void testMissingRequiredFragmentFails() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("scalagen"));
        Files.writeString(dir.resolve("header.ftl"), "package ${scalaNamespace}\n");

        assertThat(execute("-d", tempDir.toString(), "--skip-render")).isEqualTo(1);
    }

    @Test
    void testBindingErrorFailsRender() throws IOException {
        Path dir = copyBundledFragments();
        Files.writeString(dir.resolve("consts.ftl"), "<#list constants as constant>${constant.undefinedKey}</#list>");

        assertThat(execute("-d", tempDir.toString())).isEqualTo(1);
        assertThat(execute("-d", tempDir.toString(), "--skip-render")).isZero();
    }

    @Test
    void testNonexistentDirectoryFails() {
        assertThat(execute("-d", tempDir.resolve("nope").toString())).isEqualTo(1);
    }

    @Test
    void testSampleDocumentRendersThroughBundledFragments() throws IOException {
        FragmentRegistry registry = ScalaGenerator.loadFragments(new ClasspathFragmentLoader(), GeneratorConfig.defaults());

        String output = new ScalaGenerator(registry, GeneratorConfig.defaults())
                .generate(CheckFragmentsCommand.sampleDocument());

        assertThat(output)
                .startsWith("package com.example.users\n")
                .contains("object Status {")
                .contains("case class User(`userId`: Long")
                .contains("object UserService {");
    }

    private int execute(String... args) {
        return new CommandLine(new CheckFragmentsCommand()).execute(args);
    }

    private Path copyBundledFragments() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("scalagen"));
        ClasspathFragmentLoader loader = new ClasspathFragmentLoader();
        for (String name : ScalaGenerator.FRAGMENT_NAMES) {
            Files.writeString(dir.resolve(name + ".ftl"), loader.load("/scalagen/", name));
        }
        return dir;
    }
}
