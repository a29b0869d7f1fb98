package com.psl.orchestrator.decompose;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class QueryDecomposerTest {

    private final QueryDecomposer decomposer = new QueryDecomposer();

    @Test
    void upperCaseAndSplitsIntoRequiredParts() {
        List<SubQuery> parts = decomposer.decompose("trauma AND memory");

        assertThat(parts)
            .extracting(SubQuery::getText, SubQuery::getWeight, SubQuery::getRole)
            .containsExactly(
                tuple("trauma", 1.0, SubQuery.Role.REQUIRED),
                tuple("memory", 1.0, SubQuery.Role.REQUIRED)
            );
    }

    @Test
    void upperCaseOrSplitsIntoOptionalParts() {
        List<SubQuery> parts = decomposer.decompose("hypnosis OR meditation");

        assertThat(parts)
            .extracting(SubQuery::getText, SubQuery::getWeight, SubQuery::getRole)
            .containsExactly(
                tuple("hypnosis", 0.7, SubQuery.Role.OPTIONAL),
                tuple("meditation", 0.7, SubQuery.Role.OPTIONAL)
            );
    }

    @Test
    void naturalConjunctionSplits() {
        List<SubQuery> parts = decomposer.decompose("attachment theory and emotion regulation");

        assertThat(parts).extracting(SubQuery::getText)
            .containsExactly("attachment theory", "emotion regulation");
    }

    @Test
    void prepositionKeepsWholeQueryAsPrimary() {
        List<SubQuery> parts = decomposer.decompose("dissociation in adolescents");

        assertThat(parts)
            .extracting(SubQuery::getText, SubQuery::getWeight, SubQuery::getRole)
            .containsExactly(
                tuple("dissociation in adolescents", 1.0, SubQuery.Role.PRIMARY),
                tuple("dissociation", 0.6, SubQuery.Role.SUPPORTING),
                tuple("adolescents", 0.6, SubQuery.Role.SUPPORTING)
            );
    }

    @Test
    void commaListAddsSupportingParts() {
        List<SubQuery> parts = decomposer.decompose("trauma, memory, sleep");

        assertThat(parts).hasSize(4);
        assertThat(parts.get(0).getRole()).isEqualTo(SubQuery.Role.PRIMARY);
        assertThat(parts.subList(1, 4)).allSatisfy(part -> assertThat(part.getWeight()).isEqualTo(0.5));
    }

    @Test
    void genericLeadInDoesNotDecompose() {
        List<SubQuery> parts = decomposer.decompose("papers about dissociation");

        assertThat(parts).containsExactly(SubQuery.whole("papers about dissociation"));
    }

    @Test
    void duplicatePartsCollapseToTheWholeQuery() {
        List<SubQuery> parts = decomposer.decompose("memory AND Memory");

        assertThat(parts).containsExactly(SubQuery.whole("memory AND Memory"));
    }

    @Test
    void collapseKeepsHighestWeight() {
        List<SubQuery> collapsed = QueryDecomposer.collapse(List.of(
            new SubQuery("Trauma", 0.5, SubQuery.Role.SUPPORTING),
            new SubQuery("trauma", 1.0, SubQuery.Role.REQUIRED)
        ));

        assertThat(collapsed).hasSize(1);
        assertThat(collapsed.get(0).getText()).isEqualTo("Trauma");
        assertThat(collapsed.get(0).getWeight()).isEqualTo(1.0);
    }

    @Test
    void everyWeightStaysWithinUnitInterval() {
        for (String query : List.of(
            "trauma AND memory",
            "hypnosis OR meditation",
            "trauma, memory, sleep",
            "Childhood Trauma and Adult Attachment Styles",
            "dissociation in adolescents"
        )) {
            assertThat(decomposer.decompose(query))
                .allSatisfy(part -> assertThat(part.getWeight()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0));
        }
    }

    @Test
    void explicitDecompositionIgnoresNaturalConjunctions() {
        assertThat(decomposer.decomposeExplicit("attachment theory AND trauma in 2020"))
            .extracting(SubQuery::getText, SubQuery::getRole)
            .containsExactly(
                tuple("attachment theory", SubQuery.Role.REQUIRED),
                tuple("trauma in 2020", SubQuery.Role.REQUIRED)
            );
        assertThat(decomposer.decomposeExplicit("who worked with Spiegel and van der Hart"))
            .extracting(SubQuery::getRole)
            .containsExactly(SubQuery.Role.PRIMARY);
    }

    @Test
    void blankQueryYieldsNothing() {
        assertThat(decomposer.decompose("  ")).isEmpty();
    }
}
