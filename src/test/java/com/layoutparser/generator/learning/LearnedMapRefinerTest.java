package com.layoutparser.generator.learning;

import org.junit.jupiter.api.Test;

import com.layoutparser.generator.codegen.FieldLength;
import com.layoutparser.generator.codegen.GeneratedMap;

import static org.assertj.core.api.Assertions.*;

class LearnedMapRefinerTest {

    private final LearnedMapRefiner refiner = new LearnedMapRefiner(0.8);

    @Test
    void testFallbackIdentifierReplacedByLearnedOne() {
        LearnedModel model = LearnedModel.builder()
                .layoutName("NotaFiscalEntrada")
                .pattern(pattern("DETALHE", "X", 0.9))
                .pattern(pattern("LINHA000", "Q", 0.99))
                .build();

        LearnedMapRefiner.Refinement refinement = refiner.refine(map(), model);

        assertThat(refinement.getMap().getLines()).extracting(GeneratedMap.MapLine::getIdentifier)
                .containsExactly("A", "X");
        assertThat(refinement.getChanges()).containsExactly("Line DETALHE: identifier D replaced by learned X");
        assertThat(refinement.getMap().getLines().get(1).getFields()).hasSize(1);
    }

    @Test
    void testLowConfidencePatternIgnored() {
        LearnedModel model = LearnedModel.builder().pattern(pattern("DETALHE", "X", 0.5)).build();

        LearnedMapRefiner.Refinement refinement = refiner.refine(map(), model);

        assertThat(refinement.getChanges()).isEmpty();
        assertThat(refinement.getMap().getLines().get(1).getIdentifier()).isEqualTo("D");
    }

    private static GeneratedMap map() {
        return GeneratedMap.builder()
                .layoutName("NotaFiscalEntrada")
                .line(GeneratedMap.MapLine.builder().identifier("A").name("LINHA000").sequenceKey(1)
                        .field(new GeneratedMap.MapField("numero", FieldLength.plain(9))).build())
                .line(GeneratedMap.MapLine.builder().identifier("D").name("DETALHE").sequenceKey(5000)
                        .field(new GeneratedMap.MapField("produto", FieldLength.plain(20))).build())
                .build();
    }

    private static LearnedPattern pattern(String lineName, String identifier, double confidence) {
        return LearnedPattern.builder()
                .type(LearnedPattern.TCL_LINE)
                .name(lineName)
                .pattern(identifier + ":")
                .confidence(confidence)
                .frequency(3)
                .metadataEntry("identifier", identifier)
                .build();
    }
}
