package io.statewalk.core.graph;

import static io.statewalk.core.TestModels.child;
import static io.statewalk.core.TestModels.context;
import static io.statewalk.core.TestModels.init;
import static io.statewalk.core.TestModels.state;
import static org.assertj.core.api.Assertions.assertThat;

import io.statewalk.core.model.MachineEdge;
import io.statewalk.core.model.MachineModel;
import io.statewalk.core.model.NodeKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GraphAnalyzerTest {

    private static MachineModel linear() {
        return MachineModel.builder("linear")
                .node(state("a"))
                .node(state("b"))
                .node(state("c"))
                .edge(MachineEdge.from("a").to("b").build())
                .edge(MachineEdge.from("b").to("c").build())
                .build();
    }

    @Nested
    class EntryAndExitPoints {

        @Test
        void shouldFindNodesWithoutIncomingTransitions() {
            GraphAnalyzer analyzer = new GraphAnalyzer(linear());

            assertThat(analyzer.findEntryPoints()).containsExactly("a");
            assertThat(analyzer.findExitPoints()).containsExactly("c");
        }

        @Test
        void shouldTreatInitNodesAsEntryPointsEvenWithIncomingEdges() {
            MachineModel model =
                    MachineModel.builder("loop")
                            .node(init("start"))
                            .node(state("work"))
                            .edge(MachineEdge.from("start").to("work").build())
                            .edge(MachineEdge.from("work").to("start").build())
                            .build();

            assertThat(new GraphAnalyzer(model).findEntryPoints()).containsExactly("start");
        }

        @Test
        void shouldIgnoreContextNodesAndNestedChildren() {
            MachineModel model =
                    MachineModel.builder("nested")
                            .node(state("module"))
                            .node(child("inner", NodeKind.TASK, "module"))
                            .node(context("data"))
                            .edge(MachineEdge.from("inner").to("data").build())
                            .build();

            GraphAnalyzer analyzer = new GraphAnalyzer(model);

            assertThat(analyzer.findEntryPoints()).containsExactly("module");
            assertThat(analyzer.findUnreachableNodes()).isEmpty();
        }

        @Test
        void shouldNotCountAccessEdgesAsTransitions() {
            MachineModel model =
                    MachineModel.builder("access")
                            .node(state("a"))
                            .node(context("data"))
                            .edge(MachineEdge.from("data").to("a").build())
                            .build();

            assertThat(new GraphAnalyzer(model).findEntryPoints()).containsExactly("a");
        }
    }

    @Nested
    class Reachability {

        @Test
        void shouldReportUnreachableAndOrphanedNodes() {
            MachineModel model =
                    MachineModel.builder("islands")
                            .node(state("a"))
                            .node(state("b"))
                            .node(state("x"))
                            .node(state("y"))
                            .node(state("lonely"))
                            .edge(MachineEdge.from("a").to("b").build())
                            .edge(MachineEdge.from("x").to("y").build())
                            .edge(MachineEdge.from("y").to("x").build())
                            .build();

            GraphAnalyzer analyzer = new GraphAnalyzer(model);

            assertThat(analyzer.findUnreachableNodes()).containsExactly("x", "y");
            assertThat(analyzer.findOrphanedNodes()).containsExactly("lonely");
        }

        @Test
        void shouldFindShortestPath() {
            MachineModel model =
                    MachineModel.builder("diamond")
                            .node(state("a"))
                            .node(state("b"))
                            .node(state("c"))
                            .node(state("d"))
                            .edge(MachineEdge.from("a").to("b").build())
                            .edge(MachineEdge.from("b").to("c").build())
                            .edge(MachineEdge.from("c").to("d").build())
                            .edge(MachineEdge.from("a").to("d").build())
                            .build();

            GraphAnalyzer analyzer = new GraphAnalyzer(model);

            assertThat(analyzer.findPath("a", "d")).containsExactly("a", "d");
            assertThat(analyzer.findPath("d", "a")).isEmpty();
            assertThat(analyzer.findPath("b", "b")).containsExactly("b");
            assertThat(analyzer.findLongestPath()).containsExactly("a", "b", "c", "d");
        }

        @Test
        void shouldFollowInheritedExitsOfModules() {
            MachineModel model =
                    MachineModel.builder("module")
                            .node(state("module"))
                            .node(child("step", NodeKind.TASK, "module"))
                            .node(state("after"))
                            .edge(MachineEdge.from("module").to("after").build())
                            .build();

            GraphAnalyzer analyzer = new GraphAnalyzer(model);

            assertThat(analyzer.successors("module")).containsExactly("after", "step");
            assertThat(analyzer.successors("step")).containsExactly("after");
            assertThat(analyzer.findPath("step", "after")).containsExactly("step", "after");
        }
    }

    @Nested
    class Cycles {

        @Test
        void shouldReportSelfLoopAsCycleOfLengthOne() {
            MachineModel model =
                    MachineModel.builder("self")
                            .node(state("a"))
                            .edge(MachineEdge.from("a").to("a").build())
                            .build();

            assertThat(new GraphAnalyzer(model).detectCycles()).containsExactly(List.of("a"));
        }

        @Test
        void shouldStartEachCycleAtEarliestDeclaredNode() {
            MachineModel model =
                    MachineModel.builder("ring")
                            .node(state("a"))
                            .node(state("b"))
                            .node(state("c"))
                            .edge(MachineEdge.from("c").to("a").build())
                            .edge(MachineEdge.from("a").to("b").build())
                            .edge(MachineEdge.from("b").to("c").build())
                            .edge(MachineEdge.from("b").to("a").build())
                            .build();

            assertThat(new GraphAnalyzer(model).detectCycles())
                    .containsExactlyInAnyOrder(List.of("a", "b", "c"), List.of("a", "b"));
        }

        @Test
        void shouldReturnNoCyclesForAcyclicGraph() {
            GraphAnalyzer analyzer = new GraphAnalyzer(linear());

            assertThat(analyzer.detectCycles()).isEmpty();
            assertThat(analyzer.validate().isClean()).isTrue();
        }

        @Test
        void shouldMatchExhaustiveEnumerationOnRandomGraphs() {
            for (int seed = 0; seed < 45; seed++) {
                Random random = new Random(seed);
                int size = 2 + seed % 9;
                boolean[][] adjacency = new boolean[size][size];
                MachineModel.Builder builder = MachineModel.builder("random-" + seed);
                for (int i = 0; i < size; i++) {
                    builder.node(state("n" + i));
                }
                for (int i = 0; i < size; i++) {
                    for (int j = 0; j < size; j++) {
                        if (random.nextDouble() < 0.3) {
                            adjacency[i][j] = true;
                            builder.edge(MachineEdge.from("n" + i).to("n" + j).build());
                        }
                    }
                }

                List<List<String>> reported = new GraphAnalyzer(builder.build()).detectCycles();

                assertThat(new HashSet<>(reported))
                        .as("seed %d", seed)
                        .hasSize(reported.size())
                        .isEqualTo(exhaustiveCycles(adjacency));
            }
        }

        // every simple cycle from every start, rotated to begin at its lowest node
        private Set<List<String>> exhaustiveCycles(boolean[][] adjacency) {
            Set<List<String>> cycles = new HashSet<>();
            for (int start = 0; start < adjacency.length; start++) {
                List<Integer> path = new ArrayList<>();
                path.add(start);
                extend(adjacency, path, cycles);
            }
            return cycles;
        }

        private void extend(boolean[][] adjacency, List<Integer> path, Set<List<String>> cycles) {
            int last = path.get(path.size() - 1);
            if (adjacency[last][path.get(0)]) {
                cycles.add(canonical(path));
            }
            for (int next = 0; next < adjacency.length; next++) {
                if (adjacency[last][next] && !path.contains(next)) {
                    path.add(next);
                    extend(adjacency, path, cycles);
                    path.remove(path.size() - 1);
                }
            }
        }

        private List<String> canonical(List<Integer> cycle) {
            int lowest = 0;
            for (int i = 1; i < cycle.size(); i++) {
                if (cycle.get(i) < cycle.get(lowest)) {
                    lowest = i;
                }
            }
            List<String> rotated = new ArrayList<>();
            for (int i = 0; i < cycle.size(); i++) {
                rotated.add("n" + cycle.get((lowest + i) % cycle.size()));
            }
            return rotated;
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldReportMissingEntryPoints() {
            MachineModel model =
                    MachineModel.builder("closed")
                            .node(state("a"))
                            .node(state("b"))
                            .edge(MachineEdge.from("a").to("b").build())
                            .edge(MachineEdge.from("b").to("a").build())
                            .build();

            ValidationReport report = new GraphAnalyzer(model).validate();

            assertThat(report.issuesOf(ValidationReport.IssueType.NO_ENTRY_POINTS)).hasSize(1);
            assertThat(report.issuesOf(ValidationReport.IssueType.CYCLE))
                    .singleElement()
                    .satisfies(issue -> assertThat(issue.message()).isEqualTo("Cycle: a -> b -> a"));
            assertThat(report.isClean()).isFalse();
        }

        @Test
        void shouldComputeStatistics() {
            MachineModel model =
                    MachineModel.builder("stats")
                            .node(state("a"))
                            .node(child("b", NodeKind.TASK, "a"))
                            .node(context("data"))
                            .edge(MachineEdge.from("b").to("data").build())
                            .build();

            GraphStatistics statistics = new GraphAnalyzer(model).getStatistics();

            assertThat(statistics.nodeCount()).isEqualTo(3);
            assertThat(statistics.edgeCount()).isEqualTo(1);
            assertThat(statistics.maxDepth()).isEqualTo(1);
            assertThat(statistics.nodesByKind())
                    .containsEntry(NodeKind.STATE, 1)
                    .containsEntry(NodeKind.TASK, 1)
                    .containsEntry(NodeKind.CONTEXT, 1);
        }
    }
}
