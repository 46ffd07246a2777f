package io.schemaxtract.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DepthGuard")
class DepthGuardTest {

    @Test
    @DisplayName("Depth up to the ceiling is visited, deeper is cut")
    void permitsUpToCeiling() {
        DepthGuard guard = new DepthGuard(2);

        assertThat(guard.permits(0)).isTrue();
        assertThat(guard.permits(2)).isTrue();
        assertThat(guard.permits(3)).isFalse();
    }

    @Test
    @DisplayName("Self-recursive walk terminates at the ceiling")
    void recursiveWalkStopsAtCeiling() {
        DepthGuard guard = new DepthGuard(5);
        List<Integer> visited = new ArrayList<>();

        walk(guard, "node", 0, visited);

        assertThat(visited).containsExactly(0, 1, 2, 3, 4, 5);
    }

    @Test
    @DisplayName("descend reports a cut branch without calling the visitor")
    void descendReportsCut() {
        DepthGuard guard = new DepthGuard(0);
        List<String> visited = new ArrayList<>();

        assertThat(guard.descend("root", 0, (node, depth) -> visited.add(node))).isTrue();
        assertThat(guard.descend("child", 1, (node, depth) -> visited.add(node))).isFalse();
        assertThat(visited).containsExactly("root");
    }

    @Test
    @DisplayName("Negative ceiling → IllegalArgumentException")
    void negativeCeilingRejected() {
        assertThatThrownBy(() -> new DepthGuard(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth");
    }

    // the same node again at every level, as a cyclic graph would present it
    private static void walk(DepthGuard guard, String node, int depth, List<Integer> visited) {
        guard.descend(node, depth, (current, level) -> {
            visited.add(level);
            walk(guard, current, level + 1, visited);
        });
    }
}
