package dev.pekelund.shelfscan.scanner.ocr;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.shelfscan.receipts.table.BlockType;
import dev.pekelund.shelfscan.receipts.table.OcrBlock;
import java.util.List;
import org.junit.jupiter.api.Test;

class OcrBlockGraphFactoryTest {

    private final OcrBlockGraphFactory factory = new OcrBlockGraphFactory();

    @Test
    void emitsLinesThenCellsFollowedByTheirTable() {
        OcrAnalysis analysis = new OcrAnalysis(
            List.of("Store", "Item Qty"),
            List.of(new OcrTable(List.of(
                new OcrCell("Item", 1, 1, 97.5, null),
                new OcrCell(null, 1, 2, null, null)), 88.0)),
            List.of());

        List<OcrBlock> blocks = factory.toBlocks(analysis);

        assertThat(blocks).extracting(OcrBlock::id)
            .containsExactly("line_0", "line_1", "cell_0_0", "cell_0_1", "table_0");
        assertThat(blocks).extracting(OcrBlock::type)
            .containsExactly(BlockType.LINE, BlockType.LINE, BlockType.CELL, BlockType.CELL, BlockType.TABLE);
        assertThat(blocks.get(0).confidence()).isEqualTo(OcrBlockGraphFactory.DEFAULT_CONFIDENCE);
        assertThat(blocks.get(2).confidence()).isEqualTo(97.5);
        assertThat(blocks.get(3).text()).isEmpty();
        assertThat(blocks.get(3).confidence()).isEqualTo(OcrBlockGraphFactory.DEFAULT_CONFIDENCE);
        assertThat(blocks.get(3).columnIndex()).isEqualTo(2);
        assertThat(blocks.get(4).confidence()).isEqualTo(88.0);
        assertThat(blocks.get(4).childIds()).containsExactly("cell_0_0", "cell_0_1");
    }

    @Test
    void zeroAndNaNConfidencesUseTheDefault() {
        OcrAnalysis analysis = new OcrAnalysis(List.of(),
            List.of(new OcrTable(List.of(new OcrCell("a", 1, 1, 0.0, null), new OcrCell("b", 1, 2, Double.NaN, null)),
                null)),
            List.of());

        assertThat(factory.toBlocks(analysis)).extracting(OcrBlock::confidence)
            .containsOnly(OcrBlockGraphFactory.DEFAULT_CONFIDENCE);
    }

    @Test
    void nullAnalysisHasNoBlocks() {
        assertThat(factory.toBlocks(null)).isEmpty();
    }
}
