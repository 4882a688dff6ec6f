package com.gdiff.maven;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.ArgumentMatchers.anyString;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.PathResolver;
import com.gdiff.maven.graphml.GraphMlReader;

@ExtendWith(MockitoExtension.class)
class GraphDiffMojoTest {

    @Mock
    private Log log;

    private GraphDiffMojo mojo;
    private Path testBaseDir;
    private File outputDir;

    @BeforeEach
    void setUp() throws Exception {
        mojo = new GraphDiffMojo();
        mojo.setLog(log);

        // Use target directory for test output instead of temp directory
        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(),
                String.valueOf(System.currentTimeMillis()));
        Files.createDirectories(testBaseDir);
        outputDir = testBaseDir.resolve("gdiff").toFile();

        setField(mojo, "input1", copyFixture("model_a.graphml").toFile());
        setField(mojo, "input2", copyFixture("model_b.graphml").toFile());
        setField(mojo, "outputDir", outputDir);
    }

    static void setField(Object target, String fieldName, Object value) throws Exception {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                java.lang.reflect.Field field = type.getDeclaredField(fieldName);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException e) {
                type = type.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }

    @Test
    void testExecute_MatrixWritesFourFiles() throws Exception {
        mojo.execute();

        assertThat(outputDir.toPath().resolve("model_a_model_b_diff.graphml")).exists();
        assertThat(outputDir.toPath().resolve("model_b_model_a_diff.graphml")).exists();
        assertThat(outputDir.toPath().resolve("model_a_recolored.graphml")).exists();
        assertThat(outputDir.toPath().resolve("model_b_recolored.graphml")).exists();
        verify(log).info(contains("model_a_model_b_diff.graphml: 3 shared, 4 source-only, 0 other-only"));
    }

    @Test
    void testExecute_WrittenDiffIsReadable() throws Exception {
        mojo.execute();

        GraphDocument diff = new GraphMlReader().read(outputDir.toPath().resolve("model_a_model_b_diff.graphml"));
        assertThat(diff.nodeCount()).isEqualTo(7);
        assertThat(PathResolver.find(diff, LabelPath.of("A", "b", "0")).orElseThrow().getStyle().getFontSize())
                .isEqualTo(32);
    }

    @Test
    void testExecute_UnionMode() throws Exception {
        setField(mojo, "mode", "union");
        setField(mojo, "fontSizeDelta", 0);

        mojo.execute();

        Path union = outputDir.toPath().resolve("model_a_model_b_union.graphml");
        assertThat(union).exists();
        assertThat(outputDir.list()).containsExactly("model_a_model_b_union.graphml");
        GraphDocument merged = new GraphMlReader().read(union);
        assertThat(merged.nodeCount()).isEqualTo(11);
        assertThat(PathResolver.find(merged, LabelPath.of("C")).orElseThrow().getStyle().getFontSize()).isEqualTo(12);
    }

    @Test
    void testExecute_CustomOutputNames() throws Exception {
        setField(mojo, "output", "ab.graphml");
        setField(mojo, "output2", "ba.graphml");

        mojo.execute();

        assertThat(outputDir.toPath().resolve("ab.graphml")).exists();
        assertThat(outputDir.toPath().resolve("ba.graphml")).exists();
    }

    @Test
    void testExecute_WritesReport() throws Exception {
        File report = testBaseDir.resolve("report/diff.md").toFile();
        setField(mojo, "reportFile", report);

        mojo.execute();

        String content = Files.readString(report.toPath());
        assertThat(content).contains("model_a.graphml vs model_b.graphml").contains("### source-only (4)");
    }

    @Test
    void testExecute_ConfigFileSetsMode() throws Exception {
        Path config = testBaseDir.resolve("gdiff.yml");
        Files.writeString(config, "mode: union\n");
        setField(mojo, "configFile", config.toFile());

        mojo.execute();

        assertThat(outputDir.toPath().resolve("model_a_model_b_union.graphml")).exists();
    }

    @Test
    void testExecute_MissingInput() throws Exception {
        setField(mojo, "input2", testBaseDir.resolve("missing.graphml").toFile());

        MojoExecutionException e = assertThrows(MojoExecutionException.class, () -> mojo.execute());
        assertThat(e.getMessage()).contains("missing.graphml");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testExecute_InvalidModeFails() throws Exception {
        setField(mojo, "mode", "triple");

        MojoFailureException e = assertThrows(MojoFailureException.class, () -> mojo.execute());
        assertThat(e.getMessage()).contains("triple");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testExecute_MalformedInputWritesNothing() throws Exception {
        Path broken = testBaseDir.resolve("broken.graphml");
        Files.writeString(broken, "<graphml xmlns=\"http://graphml.graphdrawing.org/xmlns\"><graph id=\"G\">"
                + "<node id=\"n0\"/></graph></graphml>");
        setField(mojo, "input2", broken.toFile());

        assertThrows(MojoFailureException.class, () -> mojo.execute());
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testExecute_DuplicateLabelsAreLogged() throws Exception {
        Path duplicated = testBaseDir.resolve("duplicated.graphml");
        String xml = Files.readString(Path.of("src/test/resources/graphs/model_b.graphml"))
                .replace(">C</y:NodeLabel>", ">A</y:NodeLabel>");
        Files.writeString(duplicated, xml);
        setField(mojo, "input2", duplicated.toFile());

        mojo.execute();

        verify(log, atLeastOnce()).warn(contains("Duplicate sibling label at A"));
    }

    @Test
    void testExecute_DuplicateLabelsFailWhenRequested() throws Exception {
        Path duplicated = testBaseDir.resolve("duplicated.graphml");
        String xml = Files.readString(Path.of("src/test/resources/graphs/model_b.graphml"))
                .replace(">C</y:NodeLabel>", ">A</y:NodeLabel>");
        Files.writeString(duplicated, xml);
        setField(mojo, "input2", duplicated.toFile());
        setField(mojo, "duplicateLabels", "fail");

        assertThrows(MojoFailureException.class, () -> mojo.execute());
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testExecute_Skip() throws Exception {
        setField(mojo, "skip", true);

        mojo.execute();

        assertThat(outputDir).doesNotExist();
        verify(log, never()).warn(anyString());
    }

    private Path copyFixture(String name) throws IOException {
        Path target = testBaseDir.resolve("inputs").resolve(name);
        Files.createDirectories(target.getParent());
        try (InputStream in = getClass().getResourceAsStream("/graphs/" + name)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }
}
