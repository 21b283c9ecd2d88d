package com.symmetryvaults.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void listGroups_showsOrdersAndDegrees() {
        CliTestSupport.Result result = CliTestSupport.run("list", "groups");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("Available Groups:", "(symbol: D)", "S4: order 24, acts on 4 points");
    }

    @Test
    void listGraphs_showsFixedAndParameterizedFamilies() {
        CliTestSupport.Result result = CliTestSupport.run("list", "graphs");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("Available Graphs:", "(ID: cycle)", "cycle_5: 5 vertices",
            "petersen: 10 vertices");
    }

    @Test
    void list_unknownType_fails() {
        CliTestSupport.Result result = CliTestSupport.run("list", "rings");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Unknown type: rings");
    }
}
