package uk.gegc.questionnaire.features.condition.domain.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.questionnaire.features.condition.domain.model.ComplexCondition;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;
import uk.gegc.questionnaire.features.condition.domain.model.SimpleCondition;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DependencyGraphBuilder")
class DependencyGraphBuilderTest {

    private static QuestionSnapshot question(String id, String title, DisplayCondition condition) {
        return new QuestionSnapshot(id, title, "paper-1", condition);
    }

    private static SimpleCondition dependsOn(String id) {
        return new SimpleCondition(id, "yes");
    }

    private static List<QuestionSnapshot> chain() {
        return List.of(
                question("q1", "First", null),
                question("q2", "Second", dependsOn("q1")),
                question("q3", "Third", dependsOn("q2"))
        );
    }

    @Nested
    @DisplayName("extractDependencies")
    class ExtractDependencies {

        @Test
        @DisplayName("returns nothing for a missing condition")
        void nullCondition_returnsEmpty() {
            assertThat(DependencyGraphBuilder.extractDependencies(null)).isEmpty();
        }

        @Test
        @DisplayName("collects nested references once, in first-seen order")
        void nestedCondition_deduplicatesInOrder() {
            DisplayCondition condition = ComplexCondition.or(
                    dependsOn("q3"),
                    ComplexCondition.and(dependsOn("q1"), dependsOn("q3")),
                    dependsOn("q2")
            );

            assertThat(DependencyGraphBuilder.extractDependencies(condition))
                    .containsExactly("q3", "q1", "q2");
        }
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects duplicate question ids")
        void duplicateIds_throw() {
            List<QuestionSnapshot> snapshot = List.of(
                    question("q1", "First", null),
                    question("q1", "Again", null)
            );

            assertThatThrownBy(() -> new DependencyGraphBuilder(snapshot))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("q1");
        }

        @Test
        @DisplayName("builds one edge list per question in snapshot order")
        void buildsEdges() {
            DependencyGraph graph = new DependencyGraphBuilder(chain()).getDependencyGraph();

            assertThat(graph.edges()).containsOnlyKeys("q1", "q2", "q3");
            assertThat(graph.questionIds()).containsExactly("q1", "q2", "q3");
            assertThat(graph.dependenciesOf("q3")).containsExactly("q2");
            assertThat(graph.dependenciesOf("q1")).isEmpty();
            assertThat(graph.edgeCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("getQuestionDependencies")
    class QuestionDependencies {

        @Test
        @DisplayName("splits direct and indirect dependencies along a chain")
        void chain_directAndIndirect() {
            DependencyAnalysis analysis = new DependencyGraphBuilder(chain()).getQuestionDependencies("q3");

            assertThat(analysis.directDependencies()).containsExactly("q2");
            assertThat(analysis.indirectDependencies()).containsExactly("q1");
            assertThat(analysis.totalDependencies()).isEqualTo(2);
            assertThat(analysis.dependencyChain()).containsExactly("q2", "q1");
        }

        @Test
        @DisplayName("does not follow references to unknown questions")
        void unknownReference_notCounted() {
            DependencyGraphBuilder builder = new DependencyGraphBuilder(List.of(
                    question("q1", "First", dependsOn("ghost"))
            ));

            DependencyAnalysis analysis = builder.getQuestionDependencies("q1");

            assertThat(analysis.directDependencies()).containsExactly("ghost");
            assertThat(analysis.indirectDependencies()).isEmpty();
            assertThat(analysis.totalDependencies()).isZero();
        }

        @Test
        @DisplayName("terminates on cycles")
        void cycle_terminates() {
            DependencyGraphBuilder builder = new DependencyGraphBuilder(List.of(
                    question("q1", "First", dependsOn("q2")),
                    question("q2", "Second", dependsOn("q1"))
            ));

            DependencyAnalysis analysis = builder.getQuestionDependencies("q1");

            assertThat(analysis.directDependencies()).containsExactly("q2");
            assertThat(analysis.totalDependencies()).isEqualTo(2);
        }

        @Test
        @DisplayName("stops expanding past the maximum chain depth")
        void longChain_isCapped() {
            List<QuestionSnapshot> snapshot = new ArrayList<>();
            snapshot.add(question("q0", "Root", null));
            for (int i = 1; i <= 15; i++) {
                snapshot.add(question("q" + i, "Question " + i, dependsOn("q" + (i - 1))));
            }

            DependencyAnalysis analysis = new DependencyGraphBuilder(snapshot).getQuestionDependencies("q15");

            assertThat(analysis.totalDependencies()).isLessThan(15);
            assertThat(analysis.totalDependencies()).isEqualTo(DependencyLimits.MAX_DEPENDENCY_CHAIN_DEPTH + 1);
        }
    }

    @Nested
    @DisplayName("detectClusters")
    class Clusters {

        @Test
        @DisplayName("reports a mutual pair as a strongly connected cluster")
        void mutualPair_isStrong() {
            DependencyGraphBuilder builder = new DependencyGraphBuilder(List.of(
                    question("q1", "First", dependsOn("q2")),
                    question("q2", "Second", dependsOn("q1")),
                    question("q3", "Alone", null)
            ));

            List<DependencyCluster> clusters = builder.detectClusters();

            assertThat(clusters).hasSize(1);
            assertThat(clusters.get(0).nodes()).containsExactlyInAnyOrder("q1", "q2");
            assertThat(clusters.get(0).stronglyConnected()).isTrue();
        }

        @Test
        @DisplayName("keeps weakly connected clusters only when asked")
        void chain_isWeakOnly() {
            DependencyGraphBuilder builder = new DependencyGraphBuilder(chain());

            assertThat(builder.detectClusters(true)).isEmpty();

            List<DependencyCluster> all = builder.detectClusters(false);
            assertThat(all).hasSize(1);
            assertThat(all.get(0).nodes()).containsExactlyInAnyOrder("q1", "q2", "q3");
            assertThat(all.get(0).stronglyConnected()).isFalse();
        }
    }
}
