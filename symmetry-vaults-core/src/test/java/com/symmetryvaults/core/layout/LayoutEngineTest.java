package com.symmetryvaults.core.layout;

import com.symmetryvaults.core.group.GroupCatalog;
import com.symmetryvaults.core.symmetry.CayleyTable;
import com.symmetryvaults.core.symmetry.CayleyTableBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link LayoutEngine}.
 */
class LayoutEngineTest {

    private final LayoutEngine engine = new LayoutEngine(LayoutSettings.defaults());

    @Test
    void compute_placesIdentityAtCentre() {
        RoomLayout layout = engine.compute(tableOf("D4"));

        NodePosition identity = layout.positions().get(0);
        assertThat(identity.id()).isEqualTo("e");
        assertThat(identity.layer()).isZero();
        assertThat(identity.x()).isEqualTo(200.0);
        assertThat(identity.y()).isEqualTo(200.0);
    }

    @Test
    void compute_isDeterministic() {
        CayleyTable table = tableOf("S4");

        assertThat(engine.compute(table)).isEqualTo(engine.compute(table));
    }

    @Test
    void compute_keepsEveryNodeInsideTheMargin() {
        RoomLayout layout = engine.compute(tableOf("S4"));

        assertThat(layout.positions()).hasSize(24).allSatisfy(p -> {
            assertThat(p.x()).isBetween(30.0, 370.0);
            assertThat(p.y()).isBetween(30.0, 370.0);
        });
        assertThat(layout.nodeSize()).isEqualTo(7.0);
    }

    @Test
    void compute_withoutRelaxation_startsOnRings() {
        LayoutSettings settings = new LayoutSettings(400.0, 400.0, 0, 800.0, 0.1, 0.3, 30.0, 0.38);

        RoomLayout layout = new LayoutEngine(settings).compute(tableOf("Z3"));

        // single outer ring at radius 0.38 * 400
        NodePosition first = layout.positions().get(1);
        double radius = Math.hypot(first.x() - 200.0, first.y() - 200.0);
        assertThat(radius).isCloseTo(152.0, within(1e-9));
    }

    @Test
    void bfsLayers_identityIsZeroAndEveryOtherElementIsOneStepAway() {
        int[] layers = LayoutEngine.bfsLayers(tableOf("Z5"));

        assertThat(layers).containsExactly(0, 1, 1, 1, 1);
    }

    @ParameterizedTest
    @CsvSource({
        "6, 11.0",
        "12, 11.0",
        "16, 9.0",
        "24, 7.0"
    })
    void nodeSize_shrinksWithRoomCount(int rooms, double expected) {
        assertThat(LayoutEngine.nodeSize(rooms)).isEqualTo(expected);
    }

    @Test
    void settings_marginTooLarge_throws() {
        assertThatThrownBy(() -> new LayoutSettings(100.0, 100.0, 10, 800.0, 0.1, 0.3, 50.0, 0.38))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("margin");
    }

    private static CayleyTable tableOf(String groupName) {
        return new CayleyTableBuilder().build(GroupCatalog.load().generate(groupName, 48));
    }
}
