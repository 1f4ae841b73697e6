package com.domineering.core.ai.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.domineering.core.DomineeringState;
import com.domineering.core.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;

class EvaluationPipelineTest {

    private final EvaluationPipeline pipeline = EvaluationPipeline.standard();

    @Test
    void emptySquareBoardIsBalanced() {
        assertEquals(0.0, pipeline.evaluate(new DomineeringState(2, 2)));
        assertEquals(0.0, pipeline.evaluate(new DomineeringState(3, 3)));
    }

    @Test
    void widerBoardFavoursVerticalSide() {
        // Two open rows for HOME against three open columns for AWAY.
        assertEquals(-1.0, pipeline.evaluate(new DomineeringState(2, 3)));
    }

    @Test
    void reservedSlotIsNotCountedAgainAsOpen() {
        assertEquals(2.0, pipeline.evaluate(new DomineeringState(1, 2)));
        assertEquals(-2.0, pipeline.evaluate(new DomineeringState(2, 1)));
    }

    @Test
    void slotBesideBoardEdgeAndTileIsReserved() {
        DomineeringState topFilled = DomineeringState.parse(Player.AWAY, "HH", "..");
        DomineeringState bottomFilled = DomineeringState.parse(Player.AWAY, "..", "HH");

        assertEquals(2.0, pipeline.evaluate(topFilled));
        assertEquals(2.0, pipeline.evaluate(bottomFilled));
    }

    @Test
    void handlesSlotsTouchingEveryEdge() {
        assertEquals(0.0, pipeline.evaluate(new DomineeringState(1, 1)));
        assertEquals(0.0, pipeline.evaluate(DomineeringState.parse(Player.HOME, "HH", "VV")));
    }

    @Test
    void leavesOriginalPositionUntouched() {
        DomineeringState position = DomineeringState.parse(Player.HOME,
                "...",
                "H..",
                "H..");
        DomineeringState before = new DomineeringState(position);

        double first = pipeline.evaluate(position);
        double second = pipeline.evaluate(position);

        assertEquals(first, second);
        assertEquals(before, position);
    }

    @Test
    void laterStepsSeeMarksOfEarlierSteps() {
        Evaluator markFirstCell = state -> {
            state.setCell(0, 0, DomineeringState.MARKED);
            return 0;
        };
        EvaluationPipeline custom = EvaluationPipeline.builder()
                .add("mark", markFirstCell, Weight.constant(0))
                .add("open", new OpenPairEvaluator(Player.HOME), Weight.constant(1))
                .add("clear", new ClearMarks(), Weight.constant(0))
                .add("open-again", new OpenPairEvaluator(Player.HOME), Weight.constant(10))
                .build();

        assertEquals(10.0, custom.evaluate(new DomineeringState(1, 2)));
    }

    @Test
    void weightsReceiveOriginalPosition() {
        EvaluationPipeline custom = EvaluationPipeline.builder()
                .add("constant", state -> 3, position -> position.getRows())
                .add("empty-cells", DomineeringState::countEmpty, Weight.constant(-1))
                .build();

        assertEquals(3 * 4 - 8, custom.evaluate(DomineeringState.parse(Player.HOME, "HH.", "...", "..V", "..V")));
    }

    @Test
    void rejectsEmptyPipeline() {
        assertThrows(IllegalStateException.class, () -> EvaluationPipeline.builder().build());
    }

    @Test
    void tracesEachStepContributionByName() {
        Logger logger = Logger.getLogger(EvaluationPipeline.class.getName());
        List<String> messages = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        handler.setLevel(Level.FINEST);
        Level previous = logger.getLevel();
        logger.setLevel(Level.FINEST);
        logger.addHandler(handler);
        try {
            pipeline.evaluate(new DomineeringState(1, 2));
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(previous);
        }

        assertEquals(6, messages.size());
        assertTrue(messages.get(0).startsWith("home-reserved"), messages.get(0));
        assertTrue(messages.contains("home-reserved contributed 2.0"), messages.toString());
        assertTrue(messages.get(5).startsWith("clear-away-marks"), messages.get(5));
    }
}
