package com.radioss.translator.deck;

import com.radioss.translator.mapping.ElementKeyword;
import com.radioss.translator.model.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SurfaceBuilderTest {

    private final SurfaceBuilder builder = new SurfaceBuilder();

    @Test
    void testShellsAreTheirOwnSegments() {
        List<List<Integer>> segments = builder.segments(List.of(
                element(1, ElementKeyword.SHELL, 1, 2, 3, 4),
                element(2, ElementKeyword.SH3N, 4, 3, 5)));

        assertThat(segments).containsExactly(List.of(1, 2, 3, 4), List.of(4, 3, 5, 5));
    }

    @Test
    void testSingleBrickGivesSixFaces() {
        List<List<Integer>> segments = builder.segments(List.of(
                element(1, ElementKeyword.BRICK, 1, 2, 5, 4, 7, 8, 11, 10)));

        assertThat(segments).hasSize(6);
        assertThat(segments).contains(List.of(7, 8, 11, 10));
    }

    @Test
    void testSharedFaceBetweenBricksIsInternal() {
        List<List<Integer>> segments = builder.segments(List.of(
                element(1, ElementKeyword.BRICK, 1, 2, 5, 4, 7, 8, 11, 10),
                element(2, ElementKeyword.BRICK, 2, 3, 6, 5, 8, 9, 12, 11)));

        assertThat(segments).hasSize(10);
        assertThat(segments).noneMatch(face -> face.containsAll(List.of(2, 5, 8, 11)));
    }

    @Test
    void testTetraFacesRepeatTheLastNode() {
        List<List<Integer>> segments = builder.segments(List.of(
                element(1, ElementKeyword.TETRA4, 1, 2, 3, 4)));

        assertThat(segments).hasSize(4).allMatch(face -> face.size() == 4 && face.get(2).equals(face.get(3)));
    }

    @Test
    void testLineElementsHaveNoSurface() {
        assertThat(builder.segments(List.of(element(1, ElementKeyword.BEAM, 1, 2)))).isEmpty();
    }

    private static Element element(int id, ElementKeyword keyword, Integer... nodes) {
        return Element.builder().id(id).nodeIds(List.of(nodes)).keyword(keyword).build();
    }
}
