package com.symmetryvaults.core.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.symmetryvaults.core.config.EngineConfig;
import com.symmetryvaults.core.level.LevelCodec;
import com.symmetryvaults.core.level.LevelGenerator;
import com.symmetryvaults.core.level.LevelRequest;
import com.symmetryvaults.core.model.LevelDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LevelValidator}.
 */
class LevelValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private LevelGenerator generator;
    private LevelValidator validator;

    @BeforeEach
    void setUp() {
        generator = new LevelGenerator(EngineConfig.defaults());
        validator = new LevelValidator(EngineConfig.defaults());
    }

    @Test
    void checks_areDiscoveredInPriorityOrder() {
        assertThat(validator.checks()).extracting(LevelCheck::section)
            .containsExactly("structure", "symmetries", "layer_3", "layer_4", "layer_5");
    }

    @ParameterizedTest
    @ValueSource(strings = {"cycle_3", "directed_cycle_4", "complete_3", "cycle_4", "complete_4", "prism_3"})
    void validate_generatedLevel_hasNoIssues(String graph) {
        LevelDocument document = generator.generate(LevelRequest.auto(graph, 1));

        ValidationReport report = validator.validate(document);

        assertThat(report.issues()).isEmpty();
        assertThat(report.passed()).isTrue();
    }

    @Test
    void validate_namedSubgroupOfAutomorphisms_warnsButPasses() {
        LevelDocument document = generator.generate(new LevelRequest("cycle_3", "Z3", 1, 1, null, null, true));

        ValidationReport report = validator.validate(document);

        assertThat(report.passed()).isTrue();
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
            assertThat(issue.check()).isEqualTo("automorphism_group");
        });
    }

    @Test
    void validate_witnessWithElementOutsideSubgroup_reportsExactlyOneError() throws IOException {
        LevelDocument document = tamper(generator.generate(LevelRequest.auto("complete_3", 1)), root -> {
            ObjectNode witness = (ObjectNode) root.at("/layers/layer_4/subgroups/0/conjugation_witness");
            witness.put("h", "r1");
        });

        ValidationReport report = validator.validate(document);

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.isError()).isTrue();
            assertThat(issue.section()).isEqualTo("layer_4");
            assertThat(issue.subgroupIndex()).isZero();
            assertThat(issue.check()).isEqualTo("witness_h_in_subgroup");
            assertThat(issue.actual()).isEqualTo("r1");
        });
        assertThat(report.passed()).isFalse();
    }

    @Test
    void validate_droppedConjugationEntry_isReportedAsMissing() throws IOException {
        LevelDocument document = tamper(generator.generate(LevelRequest.auto("complete_3", 1)), root -> {
            ObjectNode layer4 = (ObjectNode) root.at("/layers/layer_4");
            ((ArrayNode) layer4.get("subgroups")).remove(0);
            layer4.put("classify_count", 3);
            layer4.put("cracked_count", 2);
        });

        ValidationReport report = validator.validate(document);

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.isError()).isTrue();
            assertThat(issue.section()).isEqualTo("layer_4");
            assertThat(issue.check()).isEqualTo("layer_3_coverage");
            assertThat(issue.actual()).isEqualTo("absent");
        });
        assertThat(report.passed()).isFalse();
    }

    @Test
    void validate_wrongCayleyEntry_isReported() throws IOException {
        LevelDocument document = tamper(generator.generate(LevelRequest.auto("directed_cycle_3", 1)), root ->
            ((ObjectNode) root.at("/symmetries/cayley_table/r1")).put("r1", "e"));

        ValidationReport report = validator.validate(document);

        assertThat(report.issues()).extracting(ValidationIssue::check).contains("cayley_table");
        assertThat(report.passed()).isFalse();
    }

    @Test
    void validate_wrongNormalityFlag_isReported() throws IOException {
        LevelDocument document = tamper(generator.generate(LevelRequest.auto("complete_3", 1)), root ->
            ((ObjectNode) root.at("/layers/layer_3/subgroups/1")).put("is_normal", true));

        ValidationReport report = validator.validate(document);

        assertThat(report.issues()).anySatisfy(issue -> {
            assertThat(issue.section()).isEqualTo("layer_3");
            assertThat(issue.subgroupIndex()).isEqualTo(1);
            assertThat(issue.check()).isEqualTo("is_normal");
        });
    }

    @Test
    void validate_brokenCoset_isReported() throws IOException {
        LevelDocument document = tamper(generator.generate(LevelRequest.auto("directed_cycle_4", 1)), root -> {
            ArrayNode elements = (ArrayNode) root.at("/layers/layer_5/quotient_groups/0/cosets/1/elements");
            elements.set(1, MAPPER.getNodeFactory().textNode("r2"));
        });

        ValidationReport report = validator.validate(document);

        assertThat(report.issues()).allSatisfy(issue -> assertThat(issue.section()).isEqualTo("layer_5"));
        assertThat(report.passed()).isFalse();
    }

    @Test
    void validate_nonBijectiveMapping_isReported() throws IOException {
        LevelDocument document = tamper(generator.generate(LevelRequest.auto("cycle_3", 1)), root -> {
            ArrayNode mapping = (ArrayNode) root.at("/symmetries/automorphisms/1/mapping");
            mapping.set(0, MAPPER.getNodeFactory().numberNode(mapping.get(1).asInt()));
        });

        ValidationReport report = validator.validate(document);

        assertThat(report.issues()).extracting(ValidationIssue::check).contains("valid_permutation");
    }

    @Test
    void validate_files_collectsIssuesAcrossDocuments() throws IOException {
        Path levels = Files.createDirectories(tempDir.resolve("levels"));
        Files.writeString(levels.resolve("a.json"),
            LevelCodec.write(generator.generate(LevelRequest.auto("cycle_3", 1))));
        Files.writeString(levels.resolve("b.json"),
            LevelCodec.write(generator.generate(LevelRequest.auto("directed_cycle_4", 2))));
        Files.writeString(levels.resolve("c.json"), "{ not json");
        Files.writeString(levels.resolve("notes.txt"), "ignored");

        ValidationReport report = validator.validate(List.of(levels));

        assertThat(report.documentCount()).isEqualTo(3);
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.levelId()).isEqualTo("c.json");
            assertThat(issue.section()).isEqualTo("document");
            assertThat(issue.check()).isEqualTo("parse");
        });
        assertThat(report.summary()).isEqualTo("3 document(s), 1 error(s), 0 warning(s)");
    }

    @Test
    void validate_missingFile_isParseError() {
        ValidationReport report = validator.validate(List.of(tempDir.resolve("absent.json")));

        assertThat(report.passed()).isFalse();
        assertThat(report.issues()).extracting(ValidationIssue::check).containsExactly("parse");
    }

    @Test
    void describe_includesLocationAndValues() {
        ValidationIssue issue = ValidationIssue.error("act1_level01", "layer_4", 2, "witness_result", "r1", "r2");

        assertThat(issue.describe())
            .isEqualTo("[ERROR] act1_level01 layer_4[2] witness_result: expected r1, actual r2");
    }

    private static LevelDocument tamper(LevelDocument document, Consumer<ObjectNode> edit) throws IOException {
        ObjectNode root = (ObjectNode) MAPPER.readTree(LevelCodec.write(document));
        edit.accept(root);
        return LevelCodec.parse(MAPPER.writeValueAsString(root));
    }
}
