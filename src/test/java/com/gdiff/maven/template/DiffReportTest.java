package com.gdiff.maven.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.gdiff.maven.diff.DiffMode;
import com.gdiff.maven.diff.DiffRun;
import com.gdiff.maven.diff.DuplicateLabelPolicy;
import com.gdiff.maven.diff.GraphDiffJob;
import com.gdiff.maven.diff.Palette;
import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.GraphFixtures;

@ExtendWith(MockitoExtension.class)
class DiffReportTest {

    @Mock
    private Log log;

    private DiffRun run;

    @BeforeEach
    void setUp() throws Exception {
        GraphDocument modelA = GraphFixtures.load("model_a.graphml");
        GraphDocument modelB = GraphFixtures.load("model_b.graphml");
        run = new GraphDiffJob(DiffMode.UNION, Palette.defaults(), 20, DuplicateLabelPolicy.WARN)
                .run("model_a.graphml", modelA, "model_b.graphml", modelB);
    }

    @Test
    @SuppressWarnings("unchecked")
    void context_groupsPathsByProvenance() {
        Map<String, Object> context = DiffReport.context("model_a.graphml", "model_b.graphml", run);

        assertThat(context).containsEntry("mode", "union").containsEntry("hasWarnings", false);
        List<Map<String, Object>> results = (List<Map<String, Object>>) context.get("results");
        assertThat(results).hasSize(1);
        List<Map<String, Object>> sections = (List<Map<String, Object>>) results.get(0).get("sections");
        assertThat(sections).extracting(section -> section.get("provenance"))
                .containsExactly("source-only", "other-only", "intersect");
        assertThat(sections.get(1).get("paths")).isEqualTo(List.of("A/b/2", "A/d", "C", "C/y"));
    }

    @Test
    void render_producesMarkdownSummary() throws Exception {
        DiffReport report = new DiffReport(new MustacheTemplateEngine(new TemplateLoader(null, log)));

        String markdown = report.render("model_a.graphml", "model_b.graphml", run);

        assertThat(markdown)
                .contains("# Contact map diff: model_a.graphml vs model_b.graphml")
                .contains("- `model_a_model_b_union.graphml`")
                .contains("### other-only (4)")
                .contains("- C/y")
                .doesNotContain("## Warnings");
    }
}
