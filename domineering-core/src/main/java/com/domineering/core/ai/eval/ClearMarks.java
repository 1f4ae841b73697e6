package com.domineering.core.ai.eval;

import com.domineering.core.DomineeringState;

/**
 * Housekeeping step that removes the marks left by earlier evaluators. Always scores zero.
 */
public final class ClearMarks extends MarkingEvaluator {

    @Override
    public int score(DomineeringState workingCopy) {
        clearMarks(workingCopy);
        return 0;
    }
}
